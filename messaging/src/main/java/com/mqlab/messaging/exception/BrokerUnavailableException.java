package com.mqlab.messaging.exception;

/**
 * The broker could not be reached on the first connection attempt.
 * Startup is aborted; this is never retried.
 */
public class BrokerUnavailableException extends MessagingException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
