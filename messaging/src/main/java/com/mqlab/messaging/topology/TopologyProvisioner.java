package com.mqlab.messaging.topology;

import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.connection.ConnectionStateListener;
import com.mqlab.messaging.exception.TopologyMismatchException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Declares the broker topology a queue needs for retries and dead-lettering.
 *
 * For a queue {@code Q}:
 * - {@code Q} itself, durable, with x-dead-letter-exchange = {@code Q.dlx} and
 *   x-dead-letter-routing-key = {@code Q.dlq}
 * - {@code Q.dlx}, a durable direct exchange, bound to the durable queue {@code Q.dlq}
 * - per distinct delay {@code d}: {@code Q.delay.<d>ms} with x-message-ttl = d whose expired
 *   messages are dead-lettered through the default exchange back to {@code Q}
 *
 * Declarations are idempotent on the broker. Each queue and delay route is declared once per
 * connection; after a reconnect everything already known is declared again.
 * A declaration that conflicts with an existing resource raises {@link TopologyMismatchException}.
 */
@Slf4j
public class TopologyProvisioner implements ConnectionStateListener {

    public static final String DEAD_LETTER_EXCHANGE_SUFFIX = ".dlx";
    public static final String DEAD_LETTER_QUEUE_SUFFIX = ".dlq";
    public static final String DELAY_QUEUE_INFIX = ".delay.";

    private static final String DEFAULT_EXCHANGE = "";

    private final AmqpAdmin amqpAdmin;
    private final MessagingProperties properties;
    private final Map<String, QueueOptions> declaredQueues = new ConcurrentHashMap<>();
    private final Map<String, DelayRoute> declaredDelayRoutes = new ConcurrentHashMap<>();

    public TopologyProvisioner(AmqpAdmin amqpAdmin, MessagingProperties properties) {
        this.amqpAdmin = amqpAdmin;
        this.properties = properties;
    }

    /**
     * Declare {@code name} with the configured dead-letter setting.
     */
    public void ensureQueue(String name) {
        requireName(name);
        QueueOptions known = declaredQueues.get(name);
        if (known != null) {
            return;
        }
        ensureQueue(name, QueueOptions.builder().deadLetterEnabled(properties.isDeadLetterEnabled()).build());
    }

    public synchronized void ensureQueue(String name, QueueOptions options) {
        requireName(name);
        QueueOptions known = declaredQueues.get(name);
        if (options.equals(known)) {
            return;
        }
        if (known != null) {
            log.warn("Queue {} requested with different options: known={}, requested={}", name, known, options);
        }
        declareQueue(name, options);
        declaredQueues.put(name, options);
    }

    /**
     * Declare (or reuse) the TTL queue that delivers to {@code queue} after {@code delay}.
     *
     * @return the delay queue name to publish to through the default exchange
     */
    public synchronized String ensureDelayRoute(String queue, Duration delay) {
        requireName(queue);
        if (delay == null || delay.isZero() || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be greater than zero: " + delay);
        }
        String delayQueue = delayQueueFor(queue, delay);
        if (declaredDelayRoutes.containsKey(delayQueue)) {
            return delayQueue;
        }
        DelayRoute route = new DelayRoute(queue, delay);
        declareDelayQueue(delayQueue, route);
        declaredDelayRoutes.put(delayQueue, route);
        return delayQueue;
    }

    /**
     * Declare everything known again. Called after the connection is re-established.
     */
    public synchronized void reprovision() {
        log.info("Re-declaring topology: queues={}, delayRoutes={}",
                declaredQueues.size(), declaredDelayRoutes.size());
        declaredQueues.forEach(this::declareQueue);
        declaredDelayRoutes.forEach(this::declareDelayQueue);
    }

    @Override
    public void onConnectionRecovered() {
        reprovision();
    }

    public boolean isDeclared(String queue) {
        return declaredQueues.containsKey(queue);
    }

    public String deadLetterExchangeFor(String queue) {
        return queue + DEAD_LETTER_EXCHANGE_SUFFIX;
    }

    public String deadLetterQueueFor(String queue) {
        return queue + DEAD_LETTER_QUEUE_SUFFIX;
    }

    public String delayQueueFor(String queue, Duration delay) {
        return queue + DELAY_QUEUE_INFIX + delay.toMillis() + "ms";
    }

    private void declareQueue(String name, QueueOptions options) {
        try {
            QueueBuilder builder = QueueBuilder.durable(name);

            if (options.isDeadLetterEnabled()) {
                String dlx = deadLetterExchangeFor(name);
                String dlq = deadLetterQueueFor(name);

                DirectExchange deadLetterExchange = ExchangeBuilder
                        .directExchange(dlx)
                        .durable(true)
                        .build();
                Queue deadLetterQueue = QueueBuilder.durable(dlq).build();

                amqpAdmin.declareExchange(deadLetterExchange);
                amqpAdmin.declareQueue(deadLetterQueue);
                amqpAdmin.declareBinding(BindingBuilder
                        .bind(deadLetterQueue)
                        .to(deadLetterExchange)
                        .with(dlq));

                builder.deadLetterExchange(dlx).deadLetterRoutingKey(dlq);
            }
            if (options.getMessageTtl() != null) {
                builder.ttl(Math.toIntExact(options.getMessageTtl().toMillis()));
            }
            if (options.getMaxLength() != null) {
                builder.maxLength(options.getMaxLength());
            }

            Queue queue = builder.build();
            amqpAdmin.declareQueue(queue);

            if (options.getExchange() != null && !options.getExchange().isBlank()) {
                Exchange exchange = new ExchangeBuilder(options.getExchange(), options.getExchangeType())
                        .durable(true)
                        .build();
                amqpAdmin.declareExchange(exchange);
                amqpAdmin.declareBinding(BindingBuilder
                        .bind(queue)
                        .to(exchange)
                        .with(options.getRoutingKey() != null ? options.getRoutingKey() : name)
                        .noargs());
            }

            log.info("QUEUE_DECLARED: queue={}, deadLetter={}, exchange={}",
                    name, options.isDeadLetterEnabled(), options.getExchange());
        } catch (AmqpException e) {
            throw translate(name, e);
        }
    }

    private void declareDelayQueue(String delayQueue, DelayRoute route) {
        try {
            Queue queue = QueueBuilder.durable(delayQueue)
                    .ttl(Math.toIntExact(route.delay().toMillis()))
                    .deadLetterExchange(DEFAULT_EXCHANGE)
                    .deadLetterRoutingKey(route.queue())
                    .build();
            amqpAdmin.declareQueue(queue);
            log.info("DELAY_ROUTE_DECLARED: queue={}, target={}, ttl={}ms",
                    delayQueue, route.queue(), route.delay().toMillis());
        } catch (AmqpException e) {
            throw translate(delayQueue, e);
        }
    }

    private static RuntimeException translate(String resource, AmqpException e) {
        if (isPreconditionFailure(e)) {
            log.error("TOPOLOGY_MISMATCH: resource={} exists with incompatible arguments", resource, e);
            return new TopologyMismatchException(resource, e);
        }
        return e;
    }

    /**
     * True when the broker closed the channel with PRECONDITION_FAILED (406), which is how it
     * rejects a redeclaration with different arguments.
     */
    static boolean isPreconditionFailure(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ShutdownSignalException signal
                    && signal.getReason() instanceof AMQP.Channel.Close close) {
                return close.getReplyCode() == AMQP.PRECONDITION_FAILED;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name must not be blank");
        }
    }

    private record DelayRoute(String queue, Duration delay) {
    }
}
