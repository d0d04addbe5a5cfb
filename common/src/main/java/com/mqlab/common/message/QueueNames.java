package com.mqlab.common.message;

/**
 * Constants for the queue names shared by publishers and consumers.
 */
public final class QueueNames {

    private QueueNames() {
        // Prevent instantiation
    }

    public static final String USER_CREATED = "user.created";
    public static final String USER_UPDATED = "user.updated";
    public static final String USER_DELETED = "user.deleted";
    public static final String EMAIL_NOTIFICATION = "email.notification";
}
