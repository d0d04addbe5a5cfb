package com.mqlab.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.connection.BrokerConnectionManager;
import com.mqlab.messaging.envelope.EnvelopeConverter;
import com.mqlab.messaging.envelope.EnvelopeHeaders;
import com.mqlab.messaging.envelope.MessageEnvelope;
import com.mqlab.messaging.publisher.MessagePublisher;
import com.mqlab.messaging.retry.RetryCoordinator;
import com.mqlab.messaging.topology.TopologyProvisioner;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Drives full publish → fail → delay route → redeliver → dead-letter cycles without a broker:
 * every message written through the mocked {@link RabbitTemplate} is fed back into the consumer
 * as if the delay queue had expired it.
 */
class RetryFlowScenarioTest {

    record Order(long id, String item) {
    }

    record Sent(String exchange, String routingKey, Message message) {
    }

    private final List<Sent> sent = new ArrayList<>();
    private MessagingProperties properties;
    private AmqpAdmin amqpAdmin;
    private MessagePublisher publisher;
    private MessageConsumer consumer;
    private ChannelAwareMessageListener listener;
    private Channel channel;
    private long deliveryTag;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.setPublisherConfirms(false);
        properties.setMaxRetryAttempts(3);
        properties.setRetryDelay(Duration.ofSeconds(5));

        RabbitTemplate rabbitTemplate = mock(RabbitTemplate.class);
        doAnswer(invocation -> sent.add(new Sent(invocation.getArgument(0), invocation.getArgument(1),
                invocation.getArgument(2))))
                .when(rabbitTemplate).send(anyString(), anyString(), any(Message.class));

        amqpAdmin = mock(AmqpAdmin.class);
        TopologyProvisioner topology = new TopologyProvisioner(amqpAdmin, properties);
        ObjectMapper objectMapper = new ObjectMapper();
        publisher = new MessagePublisher(rabbitTemplate, topology, mock(BrokerConnectionManager.class),
                objectMapper, properties);
        RetryCoordinator coordinator = new RetryCoordinator(publisher, properties);

        SubscriptionContainerFactory factory = (subscription, messageListener) -> {
            listener = messageListener;
            return mock(MessageListenerContainer.class);
        };
        consumer = new MessageConsumer(topology, coordinator, factory, objectMapper, properties);
        channel = mock(Channel.class);
    }

    private void deliver(Message message) throws Exception {
        message.getMessageProperties().setDeliveryTag(++deliveryTag);
        message.getMessageProperties().setConsumerQueue("orders");
        listener.onMessage(message, channel);
    }

    private Sent last() {
        return sent.get(sent.size() - 1);
    }

    @Test
    void testAlwaysFailingHandlerIsInvokedMaxRetriesPlusOneTimes() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        consumer.subscribe("orders", Order.class, order -> {
            invocations.incrementAndGet();
            return false;
        });
        MessageEnvelope published = publisher.publish(new Order(1, "book"), "orders");

        assertEquals("orders", last().routingKey());
        deliver(last().message());
        for (int attempt = 1; attempt <= 3; attempt++) {
            Sent retry = last();
            assertEquals("", retry.exchange());
            assertEquals("orders.delay.5000ms", retry.routingKey());
            assertEquals(attempt, (Integer) retry.message().getMessageProperties().getHeader(EnvelopeHeaders.RETRY_COUNT));
            deliver(retry.message());
        }

        assertEquals(4, invocations.get());

        Sent deadLetter = last();
        assertEquals("orders.dlx", deadLetter.exchange());
        assertEquals("orders.dlq", deadLetter.routingKey());
        MessageEnvelope terminal = EnvelopeConverter.fromMessage(deadLetter.message(), "orders.dlq");
        assertEquals(3, terminal.retryCount());
        assertEquals(published.id(), terminal.id());
        assertEquals(published.correlationId(), terminal.correlationId());
        assertEquals(RetryCoordinator.REASON_MAX_RETRIES, terminal.metadata().get(EnvelopeHeaders.DEAD_LETTER_REASON));

        assertEquals(5, sent.size());
        verify(channel, times(4)).basicAck(anyLong(), eq(false));
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void testHandlerRecoveringOnSecondAttempt() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        Subscription<Order> subscription = consumer.subscribe("orders", Order.class,
                order -> invocations.incrementAndGet() > 1);
        publisher.publish(new Order(1, "book"), "orders");

        deliver(last().message());
        deliver(last().message());

        assertEquals(2, invocations.get());
        assertEquals(2, sent.size());
        assertEquals(1, subscription.getRetriedCount());
        assertEquals(1, subscription.getAckedCount());
        assertEquals(0, subscription.getDeadLetteredCount());
    }

    @Test
    void testPoisonMessageGoesStraightToDeadLetter() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        consumer.subscribe("orders", Order.class, order -> invocations.incrementAndGet() > 0);

        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        deliver(new Message("{broken".getBytes(StandardCharsets.UTF_8), props));

        assertEquals(0, invocations.get());
        assertEquals(1, sent.size());
        assertEquals("orders.dlx", last().exchange());
        MessageEnvelope terminal = EnvelopeConverter.fromMessage(last().message(), "orders.dlq");
        assertEquals(0, terminal.retryCount());
        assertEquals(RetryCoordinator.REASON_DESERIALIZATION,
                terminal.metadata().get(EnvelopeHeaders.DEAD_LETTER_REASON));
        verify(channel).basicAck(1L, false);
    }

    @Test
    void testExhaustedMessageIsDroppedWhenDeadLetteringDisabled() throws Exception {
        properties.setDeadLetterEnabled(false);
        properties.setMaxRetryAttempts(1);
        consumer.subscribe("orders", Order.class, order -> false);
        publisher.publish(new Order(1, "book"), "orders");

        deliver(last().message());
        deliver(last().message());

        assertEquals(2, sent.size());
        verify(channel).basicAck(1L, false);
        verify(channel).basicNack(2L, false, false);
    }

    @Test
    void testFailedDelayRouteDeclarationRequeuesOriginal() throws Exception {
        when(amqpAdmin.declareQueue(argThat((Queue queue) -> queue != null && queue.getName().contains(".delay."))))
                .thenThrow(new AmqpConnectException(new ConnectException("refused")));
        Subscription<Order> subscription = consumer.subscribe("orders", Order.class, order -> false);
        publisher.publish(new Order(1, "book"), "orders");

        deliver(last().message());

        assertEquals(1, sent.size());
        verify(channel).basicNack(1L, false, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        assertEquals(SubscriptionState.SUBSCRIBED, subscription.getState());
        assertEquals(0, subscription.getRetriedCount());
    }
}
