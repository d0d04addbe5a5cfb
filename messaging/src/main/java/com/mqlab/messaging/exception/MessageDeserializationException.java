package com.mqlab.messaging.exception;

/**
 * A delivered payload could not be decoded into the subscribed type (poison message).
 */
public class MessageDeserializationException extends MessagingException {

    public MessageDeserializationException(String message) {
        super(message);
    }

    public MessageDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
