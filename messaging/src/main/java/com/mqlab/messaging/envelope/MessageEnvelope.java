package com.mqlab.messaging.envelope;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The unit of work travelling through the broker: an encoded payload plus its delivery metadata.
 *
 * An envelope is immutable. The {@code id}, {@code correlationId} and {@code createdAt} of a
 * logical message never change across retries; {@code retryCount} only ever grows.
 *
 * @param id            unique message id, assigned at first publish
 * @param payload       encoded body (JSON)
 * @param createdAt     time of first publish
 * @param correlationId caller supplied or generated; carried unchanged across retries
 * @param metadata      caller supplied context, insertion ordered; keys must not be reserved header names
 * @param retryCount    number of times this message has been requeued after a failure
 * @param destination   logical queue the message is addressed to
 * @param payloadType   simple name of the payload type, informational only
 */
public record MessageEnvelope(
    UUID id,
    byte[] payload,
    Instant createdAt,
    String correlationId,
    Map<String, String> metadata,
    int retryCount,
    String destination,
    String payloadType
) {

    public MessageEnvelope {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(destination, "destination");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative: " + retryCount);
        }
        if (metadata != null) {
            for (String key : metadata.keySet()) {
                if (key == null || EnvelopeHeaders.isReserved(key)) {
                    throw new IllegalArgumentException("Reserved or null metadata key: " + key);
                }
            }
        }
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Factory method for a first publish: fresh id, current timestamp, retry count 0.
     * A null or blank correlation id is replaced by a generated one.
     */
    public static MessageEnvelope create(byte[] payload, String destination, String payloadType,
                                         String correlationId, Map<String, String> metadata) {
        return new MessageEnvelope(
            UUID.randomUUID(),
            payload,
            Instant.now(),
            correlationId == null || correlationId.isBlank() ? UUID.randomUUID().toString() : correlationId,
            metadata,
            0,
            destination,
            payloadType
        );
    }

    /**
     * Copy for the next delivery attempt, with {@code retryCount} incremented by one.
     */
    public MessageEnvelope nextRetry() {
        return new MessageEnvelope(id, payload, createdAt, correlationId, metadata,
                retryCount + 1, destination, payloadType);
    }

    /**
     * Copy with one metadata entry added or replaced.
     */
    public MessageEnvelope withMetadataEntry(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new MessageEnvelope(id, payload, createdAt, correlationId, copy,
                retryCount, destination, payloadType);
    }

    /**
     * True once the retry budget is used up: {@code retryCount >= maxAttempts}.
     */
    public boolean hasExhausted(int maxAttempts) {
        return retryCount >= maxAttempts;
    }

    @Override
    public String toString() {
        return "MessageEnvelope[id=" + id
                + ", destination=" + destination
                + ", correlationId=" + correlationId
                + ", retryCount=" + retryCount
                + ", payloadType=" + payloadType
                + ", payloadBytes=" + payload.length
                + ", metadata=" + metadata + "]";
    }
}
