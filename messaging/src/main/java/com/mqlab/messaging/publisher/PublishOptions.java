package com.mqlab.messaging.publisher;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Per-publish options.
 *
 * {@code delay} above zero routes the message through the delay queue of its destination,
 * so it becomes visible to consumers only after the delay has elapsed.
 */
@Value
@Builder
public class PublishOptions {

    Duration delay;

    @Builder.Default
    boolean persistent = true;

    /** Correlation id to use; when null the MDC value or a generated one is used. */
    String correlationId;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    public static PublishOptions defaults() {
        return PublishOptions.builder().build();
    }

    public static PublishOptions withDelay(Duration delay) {
        return PublishOptions.builder().delay(delay).build();
    }

    public boolean isDelayed() {
        return delay != null && !delay.isZero() && !delay.isNegative();
    }
}
