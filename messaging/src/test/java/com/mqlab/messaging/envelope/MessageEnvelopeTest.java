package com.mqlab.messaging.envelope;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageEnvelopeTest {

    private static final byte[] PAYLOAD = "{\"userId\":1}".getBytes(StandardCharsets.UTF_8);

    @Test
    void testCreateAssignsIdAndZeroRetries() {
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "user.created", "UserCreatedMessage", null, null);

        assertNotNull(envelope.id());
        assertNotNull(envelope.createdAt());
        assertEquals(0, envelope.retryCount());
        assertFalse(envelope.correlationId().isBlank());
        assertTrue(envelope.metadata().isEmpty());
    }

    @Test
    void testCreateKeepsGivenCorrelationId() {
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "q", "T", "corr-42", Map.of());

        assertEquals("corr-42", envelope.correlationId());
    }

    @Test
    void testNextRetryPreservesIdentity() {
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "q", "T", "corr", Map.of("tenant", "a"));

        MessageEnvelope retry = envelope.nextRetry().nextRetry();

        assertEquals(2, retry.retryCount());
        assertEquals(envelope.id(), retry.id());
        assertEquals(envelope.correlationId(), retry.correlationId());
        assertEquals(envelope.createdAt(), retry.createdAt());
        assertEquals(envelope.metadata(), retry.metadata());
        assertEquals(0, envelope.retryCount());
    }

    @Test
    void testHasExhausted() {
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "q", "T", null, null);

        assertFalse(envelope.hasExhausted(1));
        assertTrue(envelope.nextRetry().hasExhausted(1));
        assertTrue(envelope.hasExhausted(0));
    }

    @Test
    void testMetadataIsCopiedAndOrdered() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("b", "2");
        source.put("a", "1");
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "q", "T", null, source);

        source.put("c", "3");

        assertEquals(2, envelope.metadata().size());
        assertEquals("b", envelope.metadata().keySet().iterator().next());
        assertThrows(UnsupportedOperationException.class, () -> envelope.metadata().put("x", "y"));
    }

    @Test
    void testWithMetadataEntryLeavesOriginalUntouched() {
        MessageEnvelope envelope = MessageEnvelope.create(PAYLOAD, "q", "T", null, Map.of("a", "1"));

        MessageEnvelope tagged = envelope.withMetadataEntry("reason", "x");

        assertEquals("x", tagged.metadata().get("reason"));
        assertEquals("1", tagged.metadata().get("a"));
        assertFalse(envelope.metadata().containsKey("reason"));
    }

    @Test
    void testRejectsNegativeRetryCount() {
        assertThrows(IllegalArgumentException.class, () -> new MessageEnvelope(
                UUID.randomUUID(), PAYLOAD, Instant.now(), "c", null, -1, "q", "T"));
    }

    @Test
    void testRejectsMissingDestination() {
        assertThrows(NullPointerException.class, () -> new MessageEnvelope(
                UUID.randomUUID(), PAYLOAD, Instant.now(), "c", null, 0, null, "T"));
    }

    @Test
    void testRejectsReservedMetadataKeys() {
        assertThrows(IllegalArgumentException.class, () -> MessageEnvelope.create(PAYLOAD, "q", "T", null,
                Map.of(EnvelopeHeaders.RETRY_COUNT, "9")));
        assertThrows(IllegalArgumentException.class, () -> MessageEnvelope.create(PAYLOAD, "q", "T", null,
                Map.of("x-death", "1")));
        assertThrows(IllegalArgumentException.class, () -> MessageEnvelope.create(PAYLOAD, "q", "T", null, null)
                .withMetadataEntry(EnvelopeHeaders.DESTINATION, "elsewhere"));
    }
}
