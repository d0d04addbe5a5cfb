package com.mqlab.messaging.connection;

/**
 * Callback for components that hold broker state (declarations, subscriptions)
 * and must rebuild it after the connection comes back.
 */
public interface ConnectionStateListener {

    /**
     * The connection was lost unexpectedly. Channels obtained before this point are stale.
     */
    default void onConnectionLost(Throwable cause) {
    }

    /**
     * A new connection is up after a loss.
     */
    default void onConnectionRecovered() {
    }
}
