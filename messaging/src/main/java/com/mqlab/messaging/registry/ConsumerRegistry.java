package com.mqlab.messaging.registry;

import com.mqlab.messaging.connection.ConnectionStateListener;
import com.mqlab.messaging.consumer.MessageConsumer;
import com.mqlab.messaging.consumer.Subscription;
import com.mqlab.messaging.exception.MessagingException;
import com.mqlab.messaging.exception.SubscriptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the subscriptions an application opened so they can be stopped together.
 *
 * {@link #unregisterAll()} runs on shutdown before the connection closes, so no handler is
 * invoked after the application stops. After a connection recovery every registered subscription
 * whose container has stopped is restarted with its original consumer tag.
 */
@Slf4j
@RequiredArgsConstructor
public class ConsumerRegistry implements ConnectionStateListener {

    private final MessageConsumer consumer;

    private final Map<String, SubscriptionInfo> active = new ConcurrentHashMap<>();

    public String register(Subscription<?> subscription) {
        register(subscription.getConsumerTag(), SubscriptionInfo.of(subscription));
        return subscription.getConsumerTag();
    }

    /**
     * @throws SubscriptionException if the tag is already registered
     */
    public void register(String consumerTag, SubscriptionInfo info) {
        if (active.putIfAbsent(consumerTag, info) != null) {
            throw new SubscriptionException("Consumer tag already registered: " + consumerTag);
        }
        log.info("Consumer registered: consumerTag={}, queue={}", consumerTag, info.queueName());
    }

    /**
     * Cancel one subscription and forget it.
     *
     * @return false if the tag was not registered
     */
    public boolean unregister(String consumerTag) {
        if (active.remove(consumerTag) == null) {
            return false;
        }
        consumer.unsubscribe(consumerTag);
        log.info("Consumer unregistered: consumerTag={}", consumerTag);
        return true;
    }

    /**
     * Cancel every subscription on a queue.
     *
     * @return number of subscriptions cancelled
     */
    public int unregisterQueue(String queueName) {
        List<String> tags = new ArrayList<>();
        active.forEach((tag, info) -> {
            if (info.queueName().equals(queueName)) {
                tags.add(tag);
            }
        });
        int cancelled = 0;
        for (String tag : tags) {
            if (unregister(tag)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public void unregisterAll() {
        List<String> tags = new ArrayList<>(active.keySet());
        if (tags.isEmpty()) {
            return;
        }
        log.info("Stopping {} consumer(s)", tags.size());

        for (String tag : tags) {
            try {
                unregister(tag);
            } catch (MessagingException e) {
                log.error("Failed to stop consumer: consumerTag={}", tag, e);
            }
        }
    }

    public Map<String, SubscriptionInfo> getActive() {
        return Map.copyOf(active);
    }

    public boolean isRegistered(String consumerTag) {
        return active.containsKey(consumerTag);
    }

    @Override
    public void onConnectionRecovered() {
        for (String tag : active.keySet()) {
            try {
                consumer.ensureRunning(tag);
            } catch (SubscriptionException e) {
                log.error("Consumer could not be restarted after recovery: consumerTag={}", tag, e);
            }
        }
    }
}
