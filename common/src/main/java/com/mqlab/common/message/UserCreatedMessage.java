package com.mqlab.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Published when a user account is created.
 *
 * Published to: user.created
 * Consumed by: User Events Service
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserCreatedMessage(
    long userId,
    String name,
    String email
) {
}
