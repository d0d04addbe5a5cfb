package com.mqlab.messaging.exception;

import lombok.Getter;

/**
 * A queue or exchange already exists on the broker with arguments that differ from
 * the ones being declared (broker reply PRECONDITION_FAILED).
 *
 * This is a configuration error. Retrying cannot fix it, so it is surfaced as-is.
 */
@Getter
public class TopologyMismatchException extends MessagingException {

    private final String resourceName;

    public TopologyMismatchException(String resourceName, Throwable cause) {
        super("Incompatible declaration for '" + resourceName + "': " + cause.getMessage(), cause);
        this.resourceName = resourceName;
    }
}
