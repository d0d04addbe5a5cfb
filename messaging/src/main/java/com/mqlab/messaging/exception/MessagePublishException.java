package com.mqlab.messaging.exception;

/**
 * Publishing failed at the transport level even after re-acquiring the connection once.
 */
public class MessagePublishException extends MessagingException {

    public MessagePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
