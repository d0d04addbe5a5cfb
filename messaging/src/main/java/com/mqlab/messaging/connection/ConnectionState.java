package com.mqlab.messaging.connection;

/**
 * Lifecycle of the broker connection owned by {@link BrokerConnectionManager}.
 */
public enum ConnectionState {
    NEW,
    CONNECTING,
    CONNECTED,
    RECOVERING,
    FAILED,
    CLOSED
}
