package com.mqlab.userevents.messaging.handler;

import com.mqlab.common.message.UserCreatedMessage;
import com.mqlab.common.message.UserDeletedMessage;
import com.mqlab.common.message.UserUpdatedMessage;
import com.mqlab.userevents.domain.UserDirectory;
import com.mqlab.userevents.domain.UserDirectory.UserView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handles user lifecycle messages by keeping the {@link UserDirectory} up to date.
 *
 * A message without a valid user id is rejected ({@code false}), which sends it through the
 * retry route and finally to the dead-letter queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserEventHandler {

    private final UserDirectory userDirectory;

    public boolean handleUserCreated(UserCreatedMessage message) {
        if (message.userId() <= 0) {
            log.warn("USER_EVENT_INVALID: user created without a valid id: {}", message.userId());
            return false;
        }
        log.info("Processing user created event for user {}: {} ({})",
                message.userId(), message.name(), message.email());

        userDirectory.put(new UserView(message.userId(), message.name(), message.email()));

        log.info("Welcome email would be sent to {}", message.email());
        return true;
    }

    public boolean handleUserUpdated(UserUpdatedMessage message) {
        if (message.userId() <= 0) {
            log.warn("USER_EVENT_INVALID: user updated without a valid id: {}", message.userId());
            return false;
        }
        log.info("Processing user updated event for user {}: {} ({})",
                message.userId(), message.name(), message.email());

        if (message.changes() != null) {
            message.changes().forEach((field, value) ->
                    log.info("User {} field {} changed to {}", message.userId(), field, value));
        }
        userDirectory.put(new UserView(message.userId(), message.name(), message.email()));
        return true;
    }

    public boolean handleUserDeleted(UserDeletedMessage message) {
        if (message.userId() <= 0) {
            log.warn("USER_EVENT_INVALID: user deleted without a valid id: {}", message.userId());
            return false;
        }
        log.info("Processing user deleted event for user {} ({})", message.userId(), message.email());

        if (!userDirectory.remove(message.userId())) {
            // already gone, e.g. a redelivery
            log.debug("User {} was not in the directory", message.userId());
        }
        return true;
    }
}
