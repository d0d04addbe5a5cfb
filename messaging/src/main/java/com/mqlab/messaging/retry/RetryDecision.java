package com.mqlab.messaging.retry;

import java.time.Duration;

/**
 * Outcome of a failed delivery.
 *
 * @param action     what happened to the message
 * @param delay      redelivery delay, only set for {@link Action#REQUEUE}
 * @param retryCount retry count carried by the message after the decision
 */
public record RetryDecision(Action action, Duration delay, int retryCount) {

    public enum Action {
        /** Republished through the delay route with an incremented retry count. */
        REQUEUE,
        /** Published to the dead-letter queue. */
        DEAD_LETTER,
        /** Dead-lettering is disabled; the broker drops the message when it is rejected. */
        DISCARD
    }

    public static RetryDecision requeue(Duration delay, int retryCount) {
        return new RetryDecision(Action.REQUEUE, delay, retryCount);
    }

    public static RetryDecision deadLetter(int retryCount) {
        return new RetryDecision(Action.DEAD_LETTER, null, retryCount);
    }

    public static RetryDecision discard(int retryCount) {
        return new RetryDecision(Action.DISCARD, null, retryCount);
    }

    public boolean isRequeue() {
        return action == Action.REQUEUE;
    }
}
