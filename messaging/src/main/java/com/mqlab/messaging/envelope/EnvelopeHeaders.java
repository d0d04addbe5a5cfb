package com.mqlab.messaging.envelope;

import com.mqlab.common.observability.MessageMdcContext;

import java.util.Set;

/**
 * Names of the AMQP headers that carry envelope fields.
 * Any other header on a delivery is treated as caller metadata.
 */
public final class EnvelopeHeaders {

    public static final String RETRY_COUNT = MessageMdcContext.RETRY_COUNT_HEADER;
    public static final String CORRELATION_ID = MessageMdcContext.CORRELATION_ID_HEADER;
    public static final String CREATED_AT = "x-created-at";
    public static final String DESTINATION = "x-destination";
    // Insertion order of the metadata headers; AMQP header tables are unordered
    public static final String METADATA_KEYS = "x-metadata-keys";

    // Written into metadata when a message is dead-lettered
    public static final String DEAD_LETTER_REASON = "x-dead-letter-reason";
    public static final String DEAD_LETTER_ERROR = "x-dead-letter-error";
    public static final String DEAD_LETTERED_AT = "x-dead-lettered-at";

    private static final Set<String> RESERVED = Set.of(RETRY_COUNT, CORRELATION_ID, CREATED_AT, DESTINATION,
            METADATA_KEYS);

    private EnvelopeHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * True for envelope fields and for the headers the broker adds when it dead-letters or expires a message.
     * Reserved names cannot be used as metadata keys.
     */
    public static boolean isReserved(String header) {
        return RESERVED.contains(header)
                || header.startsWith("x-death")
                || header.startsWith("x-first-death-")
                || header.startsWith("x-last-death-");
    }
}
