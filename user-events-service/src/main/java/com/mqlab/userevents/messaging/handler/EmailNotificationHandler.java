package com.mqlab.userevents.messaging.handler;

import com.mqlab.common.message.EmailNotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends e-mail notifications (simulated via logging).
 *
 * An invalid recipient address fails the message so it is retried and finally dead-lettered.
 * Templates use {@code {{key}}} placeholders filled from {@code templateData}.
 */
@Component
@Slf4j
public class EmailNotificationHandler {

    public boolean handleEmailNotification(EmailNotificationMessage message) {
        log.info("Processing email notification to {}: {}", message.to(), message.subject());

        if (message.to() == null || message.to().isBlank() || !message.to().contains("@")) {
            log.warn("Invalid email address: {}", message.to());
            return false;
        }

        String body = render(message);
        log.info("EMAIL_SENT: to={}, subject='{}', length={}", message.to(), message.subject(), body.length());
        return true;
    }

    String render(EmailNotificationMessage message) {
        if (message.template() == null || message.template().isBlank()) {
            return message.body() != null ? message.body() : "";
        }
        String rendered = message.template();
        Map<String, Object> data = message.templateData();
        if (data != null) {
            for (Map.Entry<String, Object> entry : data.entrySet()) {
                rendered = rendered.replace("{{" + entry.getKey() + "}}", String.valueOf(entry.getValue()));
            }
        }
        return rendered;
    }
}
