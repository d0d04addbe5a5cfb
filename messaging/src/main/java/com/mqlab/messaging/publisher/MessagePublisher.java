package com.mqlab.messaging.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqlab.common.observability.MdcKeys;
import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.connection.BrokerConnectionManager;
import com.mqlab.messaging.envelope.EnvelopeConverter;
import com.mqlab.messaging.envelope.MessageEnvelope;
import com.mqlab.messaging.exception.MessagePublishException;
import com.mqlab.messaging.exception.MessageSerializationException;
import com.mqlab.messaging.topology.TopologyProvisioner;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Publishes typed messages as envelopes.
 *
 * Key behaviour:
 * - the payload is encoded before anything touches the broker; encode errors are thrown to the caller
 * - the destination's topology is declared on first use
 * - delayed messages go to the destination's TTL delay queue instead of the destination itself
 * - messages are persistent by default; with publisher confirms enabled publish returns only after the broker acks
 * - a transport failure re-acquires the connection and retries the write once before failing
 *
 * Writes go through {@link RabbitTemplate}, which takes a channel from the connection factory's
 * channel cache for each operation, so concurrent callers never share a channel.
 */
@Slf4j
public class MessagePublisher {

    private static final String DEFAULT_EXCHANGE = "";

    private final RabbitTemplate rabbitTemplate;
    private final TopologyProvisioner topology;
    private final BrokerConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final MessagingProperties properties;
    private final RetryTemplate transportRetry;

    public MessagePublisher(RabbitTemplate rabbitTemplate,
                            TopologyProvisioner topology,
                            BrokerConnectionManager connectionManager,
                            ObjectMapper objectMapper,
                            MessagingProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.topology = topology;
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.transportRetry = RetryTemplate.builder()
                .maxAttempts(2)
                .noBackoff()
                .retryOn(AmqpConnectException.class)
                .retryOn(AmqpIOException.class)
                .build();
    }

    public <T> MessageEnvelope publish(T message, String destination) {
        return publish(message, destination, PublishOptions.defaults());
    }

    public <T> MessageEnvelope publish(T message, String destination, Duration delay) {
        return publish(message, destination, PublishOptions.withDelay(delay));
    }

    /**
     * Publish {@code message} to the queue {@code destination}.
     *
     * @return the envelope that was written, carrying the assigned id and correlation id
     * @throws MessageSerializationException if the message cannot be encoded
     * @throws MessagePublishException if the broker could not be written to
     * @throws IllegalArgumentException if a metadata key is a reserved header name
     */
    public <T> MessageEnvelope publish(T message, String destination, PublishOptions options) {
        Objects.requireNonNull(message, "message");
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination must not be blank");
        }

        byte[] payload = serialize(message);

        String correlationId = options.getCorrelationId() != null
                ? options.getCorrelationId()
                : MDC.get(MdcKeys.CORRELATION_ID);

        MessageEnvelope envelope = MessageEnvelope.create(
                payload,
                destination,
                message.getClass().getSimpleName(),
                correlationId,
                options.getMetadata()
        );

        send(envelope, options.getDelay(), options.isPersistent());
        return envelope;
    }

    /**
     * Write an existing envelope to its destination, through the delay route when {@code delay} is above zero.
     * Used for requeueing; the envelope is written as-is.
     */
    public void send(MessageEnvelope envelope, Duration delay) {
        send(envelope, delay, true);
    }

    /**
     * Write an envelope to the dead-letter queue of its destination.
     */
    public void sendToDeadLetter(MessageEnvelope envelope) {
        String queue = envelope.destination();
        topology.ensureQueue(queue);

        String exchange = topology.deadLetterExchangeFor(queue);
        String routingKey = topology.deadLetterQueueFor(queue);
        write(exchange, routingKey, EnvelopeConverter.toMessage(envelope, true), envelope);

        log.info("MESSAGE_DEAD_LETTERED: messageId={}, dlq={}, retryCount={}",
                envelope.id(), routingKey, envelope.retryCount());
    }

    private void send(MessageEnvelope envelope, Duration delay, boolean persistent) {
        String destination = envelope.destination();
        topology.ensureQueue(destination);

        String routingKey = destination;
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            routingKey = topology.ensureDelayRoute(destination, delay);
        }

        write(DEFAULT_EXCHANGE, routingKey, EnvelopeConverter.toMessage(envelope, persistent), envelope);

        log.info("MESSAGE_PUBLISHED: messageId={}, destination={}, route={}, retryCount={}, correlationId={}",
                envelope.id(), destination, routingKey, envelope.retryCount(), envelope.correlationId());
    }

    private void write(String exchange, String routingKey, Message message, MessageEnvelope envelope) {
        try {
            transportRetry.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Publish failed, re-acquiring connection and retrying once: messageId={}, cause={}",
                            envelope.id(), context.getLastThrowable().getMessage());
                    connectionManager.ensureConnected();
                }
                doWrite(exchange, routingKey, message);
                return null;
            });
        } catch (AmqpException e) {
            log.error("Failed to publish message: messageId={}, exchange='{}', routingKey={}",
                    envelope.id(), exchange, routingKey, e);
            throw new MessagePublishException(
                    "Failed to publish message " + envelope.id() + " to " + routingKey, e);
        }
    }

    private void doWrite(String exchange, String routingKey, Message message) {
        if (!properties.isPublisherConfirms()) {
            rabbitTemplate.send(exchange, routingKey, message);
            return;
        }
        long timeout = properties.getConfirmTimeout().toMillis();
        rabbitTemplate.invoke(operations -> {
            operations.send(exchange, routingKey, message);
            operations.waitForConfirmsOrDie(timeout);
            return Boolean.TRUE;
        });
    }

    private byte[] serialize(Object message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message of type {}", message.getClass().getSimpleName(), e);
            throw new MessageSerializationException(
                    "Failed to serialize message of type " + message.getClass().getName(), e);
        }
    }
}
