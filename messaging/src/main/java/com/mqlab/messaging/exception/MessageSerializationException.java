package com.mqlab.messaging.exception;

/**
 * A message could not be encoded at publish time. Nothing was sent to the broker.
 */
public class MessageSerializationException extends MessagingException {

    public MessageSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
