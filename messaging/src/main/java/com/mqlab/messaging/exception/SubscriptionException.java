package com.mqlab.messaging.exception;

/**
 * A subscription could not be started or registered.
 */
public class SubscriptionException extends MessagingException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
