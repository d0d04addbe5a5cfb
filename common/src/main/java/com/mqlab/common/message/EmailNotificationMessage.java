package com.mqlab.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Request to send an e-mail, optionally rendered from a named template.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailNotificationMessage(
    String to,
    String subject,
    String body,
    String template,
    Map<String, Object> templateData
) {

    /**
     * Factory method for a plain-text e-mail without a template.
     */
    public static EmailNotificationMessage plain(String to, String subject, String body) {
        return new EmailNotificationMessage(to, subject, body, null, null);
    }
}
