package com.mqlab.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Published when a user account is removed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserDeletedMessage(
    long userId,
    String email
) {
}
