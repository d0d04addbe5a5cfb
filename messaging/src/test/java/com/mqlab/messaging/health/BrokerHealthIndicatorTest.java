package com.mqlab.messaging.health;

import com.mqlab.messaging.connection.BrokerConnectionManager;
import com.mqlab.messaging.connection.ConnectionState;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BrokerHealthIndicatorTest {

    private BrokerConnectionManager connectionManager;
    private BrokerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        connectionManager = mock(BrokerConnectionManager.class);
        when(connectionManager.getHost()).thenReturn("rabbit.local");
        when(connectionManager.getPort()).thenReturn(5672);
        when(connectionManager.getState()).thenReturn(ConnectionState.CONNECTED);
        indicator = new BrokerHealthIndicator(connectionManager);
    }

    @Test
    void testUpWhenProbeQueueCanBeDeclared() throws Exception {
        Channel channel = mock(Channel.class);
        when(connectionManager.acquireChannel()).thenReturn(channel);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("rabbit.local", health.getDetails().get("host"));
        assertEquals(5672, health.getDetails().get("port"));

        ArgumentCaptor<String> queue = ArgumentCaptor.forClass(String.class);
        verify(channel).queueDeclare(queue.capture(), eq(false), eq(true), eq(true), isNull());
        assertTrue(queue.getValue().startsWith(BrokerHealthIndicator.PROBE_QUEUE_PREFIX));
        verify(channel).queueDelete(queue.getValue());
        verify(channel).close();
    }

    @Test
    void testDownWhenBrokerUnreachable() {
        when(connectionManager.acquireChannel())
                .thenThrow(new AmqpConnectException(new ConnectException("Connection refused")));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(health.getDetails().containsKey("error"));
    }
}
