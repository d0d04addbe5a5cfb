package com.mqlab.messaging.registry;

import com.mqlab.messaging.consumer.Subscription;

import java.time.Instant;
import java.util.Map;

/**
 * What the registry remembers about one consumer tag.
 */
public record SubscriptionInfo(
        String queueName,
        String messageType,
        int prefetchCount,
        Instant registeredAt,
        Map<String, String> metadata
) {

    public SubscriptionInfo {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SubscriptionInfo of(Subscription<?> subscription) {
        return new SubscriptionInfo(
                subscription.getQueueName(),
                subscription.getMessageType().getName(),
                subscription.getPrefetchCount(),
                Instant.now(),
                Map.of()
        );
    }
}
