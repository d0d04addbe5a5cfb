package com.mqlab.messaging.retry;

import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.envelope.EnvelopeHeaders;
import com.mqlab.messaging.envelope.MessageEnvelope;
import com.mqlab.messaging.publisher.MessagePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides what happens to a delivery whose handler failed.
 *
 * Rules:
 * - retryCount &lt; maxAttempts: republish with retryCount + 1 through the delay route for retryDelay
 * - retryCount &gt;= maxAttempts: publish unchanged to the dead-letter queue, tagged with the reason
 *
 * The delay is fixed; it does not grow between attempts.
 * Everything needed for the decision travels in the envelope, so one instance serves all subscriptions.
 * The caller acknowledges the original delivery once a decision is returned.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryCoordinator {

    public static final String REASON_MAX_RETRIES = "max-retries-exceeded";
    public static final String REASON_DESERIALIZATION = "deserialization-failed";

    private static final int MAX_ERROR_LENGTH = 500;

    private final MessagePublisher publisher;
    private final MessagingProperties properties;

    public RetryDecision handleFailure(MessageEnvelope envelope, String error) {
        return handleFailure(envelope, properties.getMaxRetryAttempts(), properties.getRetryDelay(), error);
    }

    public RetryDecision handleFailure(MessageEnvelope envelope, int maxAttempts, Duration retryDelay, String error) {
        if (!envelope.hasExhausted(maxAttempts)) {
            MessageEnvelope retry = envelope.nextRetry();
            publisher.send(retry, retryDelay);

            log.warn("RETRY_SCHEDULED: messageId={}, queue={}, attempt={}/{}, delay={}, error={}",
                    envelope.id(), envelope.destination(), retry.retryCount(), maxAttempts, retryDelay, error);
            return RetryDecision.requeue(retryDelay, retry.retryCount());
        }

        log.error("Message processing failed after {} retries: messageId={}, queue={}, error={}",
                maxAttempts, envelope.id(), envelope.destination(), error);
        return deadLetter(envelope, REASON_MAX_RETRIES, error);
    }

    /**
     * Route a message straight to the dead-letter queue without touching its retry count.
     */
    public RetryDecision deadLetter(MessageEnvelope envelope, String reason, String error) {
        if (!properties.isDeadLetterEnabled()) {
            log.error("MESSAGE_DISCARDED: dead-lettering disabled, messageId={}, queue={}, reason={}",
                    envelope.id(), envelope.destination(), reason);
            return RetryDecision.discard(envelope.retryCount());
        }

        MessageEnvelope terminal = envelope
                .withMetadataEntry(EnvelopeHeaders.DEAD_LETTER_REASON, reason)
                .withMetadataEntry(EnvelopeHeaders.DEAD_LETTER_ERROR, truncateError(error))
                .withMetadataEntry(EnvelopeHeaders.DEAD_LETTERED_AT, Instant.now().toString());
        publisher.sendToDeadLetter(terminal);
        return RetryDecision.deadLetter(terminal.retryCount());
    }

    /**
     * Truncate error message to avoid storing huge stack traces in headers.
     */
    private String truncateError(String error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) + "..." : error;
    }
}
