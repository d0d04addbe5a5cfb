package com.mqlab.messaging.consumer;

import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

/**
 * Creates the listener container that drives one subscription.
 * The returned container is configured but not started.
 */
@FunctionalInterface
public interface SubscriptionContainerFactory {

    MessageListenerContainer create(Subscription<?> subscription, ChannelAwareMessageListener listener);
}
