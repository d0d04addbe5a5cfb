package com.mqlab.messaging.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the RabbitMQ messaging layer.
 * Values can be overridden in application.yml under {@code messaging.rabbitmq}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "messaging.rabbitmq")
public class MessagingProperties {

    @NotBlank(message = "host cannot be null or empty")
    private String host = "localhost";

    @Min(value = 1, message = "port must be between 1 and 65535")
    @Max(value = 65535, message = "port must be between 1 and 65535")
    private int port = 5672;

    @NotBlank(message = "username cannot be null or empty")
    private String username = "guest";

    @NotBlank(message = "password cannot be null or empty")
    private String password = "guest";

    @NotBlank(message = "virtualHost cannot be null or empty")
    private String virtualHost = "/";

    /**
     * Requeues allowed before a failing message is dead-lettered.
     * A message is handled at most maxRetryAttempts + 1 times.
     * Default: 3
     */
    @Min(value = 0, message = "maxRetryAttempts cannot be negative")
    private int maxRetryAttempts = 3;

    /**
     * Fixed delay before a failed message is redelivered.
     * Default: 5 seconds
     */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(5);

    /**
     * Declare a dead-letter exchange/queue pair for every queue.
     * Default: true
     */
    private boolean deadLetterEnabled = true;

    /**
     * Unacknowledged deliveries a subscription may hold.
     * Default: 10
     */
    @Min(value = 1, message = "prefetchCount must be greater than 0")
    private int prefetchCount = 10;

    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(30);

    /**
     * Reconnect automatically after an unexpected connection loss.
     * Default: true
     */
    private boolean automaticRecovery = true;

    /**
     * Fixed interval between reconnect attempts, also used by listener containers.
     * Default: 10 seconds
     */
    @NotNull
    private Duration networkRecoveryInterval = Duration.ofSeconds(10);

    @NotNull
    private Duration requestedHeartbeat = Duration.ofSeconds(10);

    /**
     * Wait for a broker confirm before publish returns.
     * Default: true
     */
    private boolean publisherConfirms = true;

    @NotNull
    private Duration confirmTimeout = Duration.ofSeconds(5);

    /**
     * How long unsubscribe waits for an in-flight handler to finish.
     * Default: 10 seconds
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    @Min(value = 1, message = "channelCacheSize must be greater than 0")
    private int channelCacheSize = 25;

    @AssertTrue(message = "retryDelay must be greater than zero")
    public boolean isRetryDelayValid() {
        return isPositive(retryDelay);
    }

    @AssertTrue(message = "connectionTimeout must be greater than zero")
    public boolean isConnectionTimeoutValid() {
        return isPositive(connectionTimeout);
    }

    @AssertTrue(message = "networkRecoveryInterval must be greater than zero")
    public boolean isNetworkRecoveryIntervalValid() {
        return isPositive(networkRecoveryInterval);
    }

    @AssertTrue(message = "confirmTimeout must be greater than zero")
    public boolean isConfirmTimeoutValid() {
        return isPositive(confirmTimeout);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
