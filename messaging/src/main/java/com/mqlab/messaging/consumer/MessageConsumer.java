package com.mqlab.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqlab.common.observability.MessageMdcContext;
import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.envelope.EnvelopeConverter;
import com.mqlab.messaging.envelope.MessageEnvelope;
import com.mqlab.messaging.exception.MessageDeserializationException;
import com.mqlab.messaging.exception.SubscriptionException;
import com.mqlab.messaging.retry.RetryCoordinator;
import com.mqlab.messaging.retry.RetryDecision;
import com.mqlab.messaging.topology.TopologyProvisioner;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscribes typed handlers to queues and settles every delivery.
 *
 * Per delivery:
 * 1. Rebuild the envelope from the AMQP message and put its ids into the MDC
 * 2. Decode the payload; a decode failure is a poison message and goes straight to the DLQ
 * 3. Invoke the handler
 * 4. true => ack
 * 5. false or exception => RetryCoordinator republishes (delay route) or dead-letters, then ack
 * 6. Retry/dead-letter publish failed => nack with requeue, the broker redelivers the original
 *
 * Each subscription runs on its own listener container with a single consumer thread,
 * so at most prefetch deliveries are outstanding and the handler is never invoked concurrently
 * for one subscription.
 */
@Slf4j
public class MessageConsumer {

    private final TopologyProvisioner topologyProvisioner;
    private final RetryCoordinator retryCoordinator;
    private final SubscriptionContainerFactory containerFactory;
    private final ObjectMapper objectMapper;
    private final MessagingProperties properties;

    private final Map<String, Subscription<?>> subscriptions = new ConcurrentHashMap<>();

    public MessageConsumer(TopologyProvisioner topologyProvisioner,
                           RetryCoordinator retryCoordinator,
                           SubscriptionContainerFactory containerFactory,
                           ObjectMapper objectMapper,
                           MessagingProperties properties) {
        this.topologyProvisioner = topologyProvisioner;
        this.retryCoordinator = retryCoordinator;
        this.containerFactory = containerFactory;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public <T> Subscription<T> subscribe(String queueName, Class<T> messageType, MessageHandler<T> handler) {
        return subscribe(queueName, messageType, handler, properties.getPrefetchCount());
    }

    /**
     * Start consuming a queue.
     *
     * The queue and its dead-letter pair are declared first. Several subscriptions may share a queue;
     * the broker then distributes deliveries between them.
     *
     * @return the started subscription; its consumer tag is used to cancel it
     * @throws SubscriptionException if the listener container cannot be started
     */
    public <T> Subscription<T> subscribe(String queueName, Class<T> messageType,
                                         MessageHandler<T> handler, int prefetchCount) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be null or empty");
        }
        if (messageType == null || handler == null) {
            throw new IllegalArgumentException("messageType and handler are required");
        }
        if (prefetchCount < 1) {
            throw new IllegalArgumentException("prefetchCount must be at least 1");
        }

        topologyProvisioner.ensureQueue(queueName);

        String consumerTag = queueName + "." + UUID.randomUUID();
        Subscription<T> subscription = new Subscription<>(consumerTag, queueName, messageType, handler, prefetchCount);

        MessageListenerContainer container = containerFactory.create(subscription,
                (message, channel) -> onDelivery(subscription, message, channel));
        subscription.attach(container);

        try {
            container.start();
        } catch (AmqpException e) {
            subscription.cancel();
            throw new SubscriptionException("Failed to start consumer on queue " + queueName, e);
        }
        subscriptions.put(consumerTag, subscription);

        log.info("SUBSCRIBED: queue={}, consumerTag={}, type={}, prefetch={}",
                queueName, consumerTag, messageType.getSimpleName(), prefetchCount);
        return subscription;
    }

    /**
     * Cancel a subscription. Returns once the in-flight delivery, if any, has been settled.
     *
     * @return false if no active subscription has this tag
     */
    public boolean unsubscribe(String consumerTag) {
        Subscription<?> subscription = subscriptions.remove(consumerTag);
        if (subscription == null) {
            log.debug("No active subscription for consumerTag={}", consumerTag);
            return false;
        }

        subscription.cancel();
        MessageListenerContainer container = subscription.getContainer();
        if (container != null) {
            container.stop();
        }

        log.info("UNSUBSCRIBED: queue={}, consumerTag={}, delivered={}, acked={}, retried={}, deadLettered={}",
                subscription.getQueueName(), consumerTag, subscription.getDeliveredCount(),
                subscription.getAckedCount(), subscription.getRetriedCount(), subscription.getDeadLetteredCount());
        return true;
    }

    /**
     * Restart the container of a subscription that stopped on its own, for example after its
     * consumer gave up during a long broker outage. The consumer tag stays the same.
     */
    public void ensureRunning(String consumerTag) {
        Subscription<?> subscription = subscriptions.get(consumerTag);
        if (subscription == null || !subscription.isActive()) {
            return;
        }
        MessageListenerContainer container = subscription.getContainer();
        if (container != null && !container.isRunning()) {
            log.info("Restarting consumer: queue={}, consumerTag={}", subscription.getQueueName(), consumerTag);
            try {
                container.start();
            } catch (AmqpException e) {
                throw new SubscriptionException("Failed to restart consumer " + consumerTag, e);
            }
        }
    }

    public Optional<Subscription<?>> getSubscription(String consumerTag) {
        return Optional.ofNullable(subscriptions.get(consumerTag));
    }

    public List<Subscription<?>> getSubscriptions() {
        return new ArrayList<>(subscriptions.values());
    }

    public void close() {
        new ArrayList<>(subscriptions.keySet()).forEach(this::unsubscribe);
    }

    <T> void onDelivery(Subscription<T> subscription, Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        try (MessageMdcContext mdcContext = new MessageMdcContext(message)) {
            subscription.beginProcessing();
            MessageEnvelope envelope = EnvelopeConverter.fromMessage(message, subscription.getQueueName());

            log.info("MESSAGE_RECEIVED: messageId={}, queue={}, retryCount={}",
                    envelope.id(), subscription.getQueueName(), envelope.retryCount());

            T payload;
            try {
                payload = decode(envelope, subscription.getMessageType());
            } catch (MessageDeserializationException e) {
                log.error("POISON_MESSAGE: messageId={}, queue={}, type={}, error={}",
                        envelope.id(), subscription.getQueueName(),
                        subscription.getMessageType().getSimpleName(), e.getMessage());
                settle(subscription, channel, deliveryTag, envelope,
                        () -> retryCoordinator.deadLetter(envelope, RetryCoordinator.REASON_DESERIALIZATION, e.getMessage()));
                return;
            }

            String error = null;
            boolean handled = false;
            try {
                handled = subscription.getHandler().handle(payload);
                if (!handled) {
                    error = "Handler returned false";
                }
            } catch (Exception e) {
                log.warn("Handler failed: messageId={}, queue={}", envelope.id(), subscription.getQueueName(), e);
                error = e.getClass().getSimpleName() + ": " + e.getMessage();
            }

            if (handled) {
                channel.basicAck(deliveryTag, false);
                subscription.complete(SubscriptionState.ACKED);
                log.info("MESSAGE_ACKED: messageId={}, queue={}", envelope.id(), subscription.getQueueName());
                return;
            }

            String failure = error;
            settle(subscription, channel, deliveryTag, envelope,
                    () -> retryCoordinator.handleFailure(envelope, failure));
        }
    }

    private <T> T decode(MessageEnvelope envelope, Class<T> type) {
        T payload;
        try {
            payload = objectMapper.readValue(envelope.payload(), type);
        } catch (IOException e) {
            throw new MessageDeserializationException(
                    "Cannot decode payload as " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (payload == null) {
            throw new MessageDeserializationException("Payload is empty or null, expected " + type.getSimpleName());
        }
        return payload;
    }

    /**
     * Run the retry decision and settle the original delivery accordingly.
     * If the decision step throws, the delivery is nacked with requeue so the broker redelivers it.
     */
    private void settle(Subscription<?> subscription, Channel channel, long deliveryTag,
                        MessageEnvelope envelope, DecisionStep step) throws IOException {
        RetryDecision decision;
        try {
            decision = step.decide();
        } catch (RuntimeException e) {
            // MessagingException from the publisher, or a raw AmqpException from a failed declaration
            log.error("Retry handoff failed, returning message to queue: messageId={}, queue={}",
                    envelope.id(), subscription.getQueueName(), e);
            channel.basicNack(deliveryTag, false, true);
            subscription.release();
            return;
        }

        switch (decision.action()) {
            case REQUEUE -> {
                channel.basicAck(deliveryTag, false);
                subscription.complete(SubscriptionState.RETRY_SCHEDULED);
            }
            case DEAD_LETTER -> {
                channel.basicAck(deliveryTag, false);
                subscription.complete(SubscriptionState.DEAD_LETTERED);
            }
            case DISCARD -> {
                channel.basicNack(deliveryTag, false, false);
                subscription.complete(SubscriptionState.DEAD_LETTERED);
            }
        }
    }

    @FunctionalInterface
    private interface DecisionStep {
        RetryDecision decide();
    }
}
