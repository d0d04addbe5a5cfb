package com.mqlab.messaging.topology;

import lombok.Builder;
import lombok.Value;
import org.springframework.amqp.core.ExchangeTypes;

import java.time.Duration;

/**
 * Declaration options for a main queue.
 *
 * Without an {@code exchange} the queue is reached through the default exchange by its name.
 * With one, the exchange is declared (durable, {@code direct} unless stated otherwise) and the
 * queue is bound to it with {@code routingKey}, or the queue name when no key is given.
 */
@Value
@Builder(toBuilder = true)
public class QueueOptions {

    @Builder.Default
    boolean deadLetterEnabled = true;

    String exchange;

    @Builder.Default
    String exchangeType = ExchangeTypes.DIRECT;

    String routingKey;

    /** Optional x-message-ttl for the main queue. */
    Duration messageTtl;

    /** Optional x-max-length for the main queue. */
    Long maxLength;

    public static QueueOptions defaults() {
        return QueueOptions.builder().build();
    }
}
