package com.mqlab.messaging.exception;

/**
 * Base class for failures raised by the messaging layer.
 * All subclasses are unchecked; callers decide which ones they can recover from.
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
