package com.mqlab.messaging.consumer;

/**
 * Per-subscription delivery state.
 * SUBSCRIBED → PROCESSING → {ACKED | RETRY_SCHEDULED | DEAD_LETTERED} → SUBSCRIBED, CANCELLED is terminal.
 */
public enum SubscriptionState {
    SUBSCRIBED,
    PROCESSING,
    ACKED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    CANCELLED
}
