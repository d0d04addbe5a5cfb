package com.mqlab.common.observability;

import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.UUID;

/**
 * Auto-closeable context for populating MDC from RabbitMQ deliveries.
 * Use with try-with-resources so the keys are removed after processing.
 *
 * Example:
 * <pre>
 * try (MessageMdcContext mdc = new MessageMdcContext(message)) {
 *     log.info("MESSAGE_RECEIVED"); // includes correlationId, messageId, queue...
 * }
 * </pre>
 */
public class MessageMdcContext implements AutoCloseable {

    /** Header carrying the correlation id when the AMQP property is not set. */
    public static final String CORRELATION_ID_HEADER = "x-correlation-id";

    /** Header carrying the retry count of an envelope. */
    public static final String RETRY_COUNT_HEADER = "x-retry-count";

    /**
     * Create MDC context from a RabbitMQ message.
     * Extracts correlation ID, message ID, consumer queue, routing key, type and retry count.
     *
     * @param message RabbitMQ message
     */
    public MessageMdcContext(Message message) {
        MessageProperties props = message.getMessageProperties();

        String correlationId = props.getCorrelationId();
        if (correlationId == null || correlationId.isBlank()) {
            Object header = props.getHeader(CORRELATION_ID_HEADER);
            correlationId = header != null ? header.toString() : null;
        }
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        MDC.put(MdcKeys.CORRELATION_ID, correlationId);

        putIfPresent(MdcKeys.MESSAGE_ID, props.getMessageId());
        putIfPresent(MdcKeys.QUEUE, props.getConsumerQueue());
        putIfPresent(MdcKeys.ROUTING_KEY, props.getReceivedRoutingKey());
        putIfPresent(MdcKeys.MESSAGE_TYPE, props.getType());

        Object retryCount = props.getHeader(RETRY_COUNT_HEADER);
        MDC.put(MdcKeys.RETRY_COUNT, retryCount != null ? retryCount.toString() : "0");
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        MDC.remove(MdcKeys.CORRELATION_ID);
        MDC.remove(MdcKeys.MESSAGE_ID);
        MDC.remove(MdcKeys.QUEUE);
        MDC.remove(MdcKeys.ROUTING_KEY);
        MDC.remove(MdcKeys.MESSAGE_TYPE);
        MDC.remove(MdcKeys.RETRY_COUNT);
    }
}
