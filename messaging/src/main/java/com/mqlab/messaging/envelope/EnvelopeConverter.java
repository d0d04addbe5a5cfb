package com.mqlab.messaging.envelope;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Maps envelopes to AMQP messages and back.
 *
 * Wire layout:
 * - messageId = envelope id, correlationId, timestamp, type = payload type
 * - contentType application/json, deliveryMode PERSISTENT unless asked otherwise
 * - headers: x-retry-count, x-correlation-id, x-created-at, x-destination, plus one header per metadata entry
 *   and x-metadata-keys listing the metadata keys in insertion order
 */
public final class EnvelopeConverter {

    private EnvelopeConverter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Message toMessage(MessageEnvelope envelope, boolean persistent) {
        MessageProperties properties = new MessageProperties();

        properties.setMessageId(envelope.id().toString());
        properties.setCorrelationId(envelope.correlationId());
        properties.setTimestamp(Date.from(envelope.createdAt()));
        properties.setType(envelope.payloadType());
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding("UTF-8");
        properties.setDeliveryMode(persistent ? MessageDeliveryMode.PERSISTENT : MessageDeliveryMode.NON_PERSISTENT);

        envelope.metadata().forEach(properties::setHeader);
        if (!envelope.metadata().isEmpty()) {
            properties.setHeader(EnvelopeHeaders.METADATA_KEYS, new ArrayList<>(envelope.metadata().keySet()));
        }
        properties.setHeader(EnvelopeHeaders.RETRY_COUNT, envelope.retryCount());
        properties.setHeader(EnvelopeHeaders.CORRELATION_ID, envelope.correlationId());
        properties.setHeader(EnvelopeHeaders.CREATED_AT, envelope.createdAt().toString());
        properties.setHeader(EnvelopeHeaders.DESTINATION, envelope.destination());

        return MessageBuilder
                .withBody(envelope.payload())
                .andProperties(properties)
                .build();
    }

    /**
     * Rebuild the envelope of a delivery.
     *
     * Messages that did not come through the publisher may lack a valid message id; they get a
     * name-based id derived from the body, so every redelivery of the same bytes shares one id.
     *
     * @param message        delivered message
     * @param fallbackQueue  destination to use when the message carries none (the consuming queue)
     */
    public static MessageEnvelope fromMessage(Message message, String fallbackQueue) {
        MessageProperties properties = message.getMessageProperties();
        byte[] body = message.getBody() != null ? message.getBody() : new byte[0];

        UUID id = parseId(properties.getMessageId(), body);

        String correlationId = properties.getCorrelationId();
        if (correlationId == null || correlationId.isBlank()) {
            Object header = properties.getHeader(EnvelopeHeaders.CORRELATION_ID);
            correlationId = header != null ? header.toString() : id.toString();
        }

        Object destinationHeader = properties.getHeader(EnvelopeHeaders.DESTINATION);
        String destination = destinationHeader != null ? destinationHeader.toString() : fallbackQueue;

        return new MessageEnvelope(
            id,
            body,
            readCreatedAt(properties),
            correlationId,
            readMetadata(properties),
            readRetryCount(properties.getHeader(EnvelopeHeaders.RETRY_COUNT)),
            destination,
            properties.getType()
        );
    }

    /**
     * Missing or unreadable retry headers count as a first attempt.
     */
    public static int readRetryCount(Object header) {
        if (header instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (header != null) {
            try {
                return Math.max(0, Integer.parseInt(header.toString().trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * Metadata keys listed in x-metadata-keys come first, in that order. Headers added by other
     * producers follow, sorted by name.
     */
    private static Map<String, String> readMetadata(MessageProperties properties) {
        Map<String, Object> headers = properties.getHeaders();
        Map<String, String> metadata = new LinkedHashMap<>();

        if (headers.get(EnvelopeHeaders.METADATA_KEYS) instanceof List<?> keys) {
            for (Object key : keys) {
                String name = String.valueOf(key);
                Object value = headers.get(name);
                if (value != null && !EnvelopeHeaders.isReserved(name)) {
                    metadata.put(name, value.toString());
                }
            }
        }

        new TreeMap<>(headers).forEach((name, value) -> {
            if (value != null && !EnvelopeHeaders.isReserved(name) && !metadata.containsKey(name)) {
                metadata.put(name, value.toString());
            }
        });
        return metadata;
    }

    private static UUID parseId(String messageId, byte[] body) {
        if (messageId != null && !messageId.isBlank()) {
            try {
                return UUID.fromString(messageId);
            } catch (IllegalArgumentException e) {
                return UUID.nameUUIDFromBytes(messageId.getBytes(StandardCharsets.UTF_8));
            }
        }
        return UUID.nameUUIDFromBytes(body);
    }

    private static Instant readCreatedAt(MessageProperties properties) {
        Object header = properties.getHeader(EnvelopeHeaders.CREATED_AT);
        if (header != null) {
            try {
                return Instant.parse(header.toString());
            } catch (DateTimeParseException e) {
                // fall through to the AMQP timestamp
            }
        }
        Date timestamp = properties.getTimestamp();
        return timestamp != null ? timestamp.toInstant() : Instant.now();
    }
}
