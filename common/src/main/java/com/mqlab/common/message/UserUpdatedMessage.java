package com.mqlab.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Published when a user account is modified.
 * {@code changes} maps each changed field to its new value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserUpdatedMessage(
    long userId,
    String name,
    String email,
    Map<String, Object> changes
) {
}
