package com.mqlab.messaging.registry;

import com.mqlab.messaging.consumer.MessageConsumer;
import com.mqlab.messaging.exception.SubscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConsumerRegistryTest {

    private MessageConsumer consumer;
    private ConsumerRegistry registry;

    @BeforeEach
    void setUp() {
        consumer = mock(MessageConsumer.class);
        registry = new ConsumerRegistry(consumer);
    }

    private static SubscriptionInfo info(String queue) {
        return new SubscriptionInfo(queue, "com.example.Order", 10, Instant.now(), Map.of("owner", "orders-team"));
    }

    @Test
    void testRegisterAndQuery() {
        registry.register("orders.1", info("orders"));

        assertTrue(registry.isRegistered("orders.1"));
        assertEquals("orders", registry.getActive().get("orders.1").queueName());
        assertEquals("orders-team", registry.getActive().get("orders.1").metadata().get("owner"));
    }

    @Test
    void testDuplicateTagRejected() {
        registry.register("orders.1", info("orders"));

        assertThrows(SubscriptionException.class, () -> registry.register("orders.1", info("orders")));
    }

    @Test
    void testUnregisterCancelsSubscription() {
        registry.register("orders.1", info("orders"));

        assertTrue(registry.unregister("orders.1"));
        assertFalse(registry.unregister("orders.1"));

        verify(consumer, times(1)).unsubscribe("orders.1");
        assertFalse(registry.isRegistered("orders.1"));
    }

    @Test
    void testUnregisterQueueOnlyTouchesThatQueue() {
        registry.register("orders.1", info("orders"));
        registry.register("orders.2", info("orders"));
        registry.register("invoices.1", info("invoices"));

        assertEquals(2, registry.unregisterQueue("orders"));

        verify(consumer).unsubscribe("orders.1");
        verify(consumer).unsubscribe("orders.2");
        verify(consumer, never()).unsubscribe("invoices.1");
        assertTrue(registry.isRegistered("invoices.1"));
    }

    @Test
    void testUnregisterAllContinuesPastFailures() {
        registry.register("orders.1", info("orders"));
        registry.register("invoices.1", info("invoices"));
        doThrow(new SubscriptionException("stop failed")).when(consumer).unsubscribe("orders.1");

        registry.unregisterAll();

        verify(consumer).unsubscribe("orders.1");
        verify(consumer).unsubscribe("invoices.1");
        assertTrue(registry.getActive().isEmpty());
    }

    @Test
    void testRecoveryRestartsEveryRegisteredSubscription() {
        registry.register("orders.1", info("orders"));
        registry.register("invoices.1", info("invoices"));
        doThrow(new SubscriptionException("restart failed")).when(consumer).ensureRunning("orders.1");

        registry.onConnectionRecovered();

        verify(consumer).ensureRunning("orders.1");
        verify(consumer).ensureRunning("invoices.1");
    }

    @Test
    void testGetActiveIsSnapshot() {
        registry.register("orders.1", info("orders"));

        Map<String, SubscriptionInfo> snapshot = registry.getActive();
        registry.unregister("orders.1");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("orders.1"));
    }
}
