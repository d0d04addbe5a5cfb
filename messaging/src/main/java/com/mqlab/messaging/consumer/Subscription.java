package com.mqlab.messaging.consumer;

import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One handler attached to one queue.
 *
 * The consumer tag is fixed for the lifetime of the subscription; when the listener container
 * re-consumes after a connection loss it registers with the same tag.
 */
@Getter
public class Subscription<T> {

    private final String consumerTag;
    private final String queueName;
    private final Class<T> messageType;
    private final MessageHandler<T> handler;
    private final int prefetchCount;
    private final Instant subscribedAt = Instant.now();

    @Getter(AccessLevel.NONE)
    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.SUBSCRIBED);
    @Getter(AccessLevel.NONE)
    private final AtomicReference<SubscriptionState> lastOutcome = new AtomicReference<>();
    @Getter(AccessLevel.NONE)
    private final AtomicLong delivered = new AtomicLong();
    @Getter(AccessLevel.NONE)
    private final AtomicLong acked = new AtomicLong();
    @Getter(AccessLevel.NONE)
    private final AtomicLong retried = new AtomicLong();
    @Getter(AccessLevel.NONE)
    private final AtomicLong deadLettered = new AtomicLong();

    @Getter(AccessLevel.PACKAGE)
    private volatile MessageListenerContainer container;

    Subscription(String consumerTag, String queueName, Class<T> messageType,
                 MessageHandler<T> handler, int prefetchCount) {
        this.consumerTag = consumerTag;
        this.queueName = queueName;
        this.messageType = messageType;
        this.handler = handler;
        this.prefetchCount = prefetchCount;
    }

    void attach(MessageListenerContainer container) {
        this.container = container;
    }

    void beginProcessing() {
        delivered.incrementAndGet();
        moveTo(SubscriptionState.PROCESSING);
    }

    /**
     * Record the outcome of the current delivery and go back to waiting.
     */
    void complete(SubscriptionState outcome) {
        switch (outcome) {
            case ACKED -> acked.incrementAndGet();
            case RETRY_SCHEDULED -> retried.incrementAndGet();
            case DEAD_LETTERED -> deadLettered.incrementAndGet();
            default -> {
            }
        }
        lastOutcome.set(outcome);
        moveTo(SubscriptionState.SUBSCRIBED);
    }

    /**
     * The delivery went back to the queue unresolved.
     */
    void release() {
        moveTo(SubscriptionState.SUBSCRIBED);
    }

    void cancel() {
        state.set(SubscriptionState.CANCELLED);
    }

    private void moveTo(SubscriptionState next) {
        state.updateAndGet(current -> current == SubscriptionState.CANCELLED ? current : next);
    }

    public SubscriptionState getState() {
        return state.get();
    }

    /** Outcome of the most recent completed delivery, null before the first one. */
    public SubscriptionState getLastOutcome() {
        return lastOutcome.get();
    }

    public boolean isActive() {
        return state.get() != SubscriptionState.CANCELLED;
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getAckedCount() {
        return acked.get();
    }

    public long getRetriedCount() {
        return retried.get();
    }

    public long getDeadLetteredCount() {
        return deadLettered.get();
    }

    @Override
    public String toString() {
        return "Subscription[tag=" + consumerTag + ", queue=" + queueName
                + ", type=" + messageType.getSimpleName() + ", state=" + state.get() + "]";
    }
}
