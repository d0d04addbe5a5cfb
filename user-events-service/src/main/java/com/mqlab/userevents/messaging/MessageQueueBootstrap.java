package com.mqlab.userevents.messaging;

import com.mqlab.common.message.EmailNotificationMessage;
import com.mqlab.common.message.QueueNames;
import com.mqlab.common.message.UserCreatedMessage;
import com.mqlab.common.message.UserDeletedMessage;
import com.mqlab.common.message.UserUpdatedMessage;
import com.mqlab.messaging.consumer.MessageConsumer;
import com.mqlab.messaging.registry.ConsumerRegistry;
import com.mqlab.userevents.messaging.handler.EmailNotificationHandler;
import com.mqlab.userevents.messaging.handler.UserEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Subscribes the message handlers once the application is ready.
 * Subscriptions are registered with the {@link ConsumerRegistry}, which cancels them on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageQueueBootstrap {

    private final MessageConsumer messageConsumer;
    private final ConsumerRegistry consumerRegistry;
    private final UserEventHandler userEventHandler;
    private final EmailNotificationHandler emailNotificationHandler;

    @EventListener(ApplicationReadyEvent.class)
    public void startConsumers() {
        log.info("Setting up message consumers");

        consumerRegistry.register(messageConsumer.subscribe(
                QueueNames.USER_CREATED, UserCreatedMessage.class, userEventHandler::handleUserCreated));
        consumerRegistry.register(messageConsumer.subscribe(
                QueueNames.USER_UPDATED, UserUpdatedMessage.class, userEventHandler::handleUserUpdated));
        consumerRegistry.register(messageConsumer.subscribe(
                QueueNames.USER_DELETED, UserDeletedMessage.class, userEventHandler::handleUserDeleted));
        consumerRegistry.register(messageConsumer.subscribe(
                QueueNames.EMAIL_NOTIFICATION, EmailNotificationMessage.class,
                emailNotificationHandler::handleEmailNotification));

        log.info("All message consumers have been set up: {}", consumerRegistry.getActive().size());
    }
}
