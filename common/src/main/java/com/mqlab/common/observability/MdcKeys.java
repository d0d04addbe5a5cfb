package com.mqlab.common.observability;

/**
 * Constants for MDC (Mapped Diagnostic Context) keys.
 * Used for structured logging across the publisher, the consumers and the services.
 */
public final class MdcKeys {
    public static final String CORRELATION_ID = "correlationId";
    public static final String MESSAGE_ID = "messageId";
    public static final String QUEUE = "queue";
    public static final String ROUTING_KEY = "routingKey";
    public static final String MESSAGE_TYPE = "messageType";
    public static final String RETRY_COUNT = "retryCount";

    private MdcKeys() {
        throw new UnsupportedOperationException("Utility class");
    }
}
