package com.mqlab.messaging.consumer;

import com.mqlab.messaging.config.MessagingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

/**
 * One {@link SimpleMessageListenerContainer} per subscription.
 *
 * Configuration:
 * - a single consumer thread, so a subscription never runs its handler concurrently
 * - manual acknowledgment; the consumer acks or nacks each delivery itself
 * - prefetch from the subscription, bounding unacknowledged deliveries
 * - consumer tag fixed to the subscription's tag, also on re-consume after recovery
 * - fixed recovery interval; missing queues are retried instead of stopping the container
 * - shutdown timeout lets an in-flight handler finish when the subscription is stopped
 */
@RequiredArgsConstructor
public class RabbitSubscriptionContainerFactory implements SubscriptionContainerFactory {

    private final ConnectionFactory connectionFactory;
    private final MessagingProperties properties;

    @Override
    public MessageListenerContainer create(Subscription<?> subscription, ChannelAwareMessageListener listener) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(subscription.getQueueName());
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(subscription.getPrefetchCount());
        container.setConcurrentConsumers(1);
        container.setMaxConcurrentConsumers(1);
        container.setConsumerTagStrategy(queue -> subscription.getConsumerTag());
        container.setRecoveryInterval(properties.getNetworkRecoveryInterval().toMillis());
        container.setShutdownTimeout(properties.getShutdownTimeout().toMillis());
        container.setMissingQueuesFatal(false);
        container.setDefaultRequeueRejected(true);
        container.setBeanName("subscription-" + subscription.getConsumerTag());
        container.setMessageListener(listener);
        container.afterPropertiesSet();
        return container;
    }
}
