package com.mqlab.userevents.messaging;

import com.mqlab.common.message.EmailNotificationMessage;
import com.mqlab.common.message.QueueNames;
import com.mqlab.common.message.UserCreatedMessage;
import com.mqlab.common.message.UserDeletedMessage;
import com.mqlab.common.message.UserUpdatedMessage;
import com.mqlab.messaging.consumer.MessageConsumer;
import com.mqlab.messaging.consumer.MessageHandler;
import com.mqlab.messaging.consumer.Subscription;
import com.mqlab.messaging.registry.ConsumerRegistry;
import com.mqlab.userevents.domain.UserDirectory;
import com.mqlab.userevents.messaging.handler.EmailNotificationHandler;
import com.mqlab.userevents.messaging.handler.UserEventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageQueueBootstrapTest {

    private MessageConsumer consumer;
    private ConsumerRegistry registry;
    private UserDirectory directory;
    private MessageQueueBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        consumer = mock(MessageConsumer.class);
        registry = mock(ConsumerRegistry.class);
        directory = new UserDirectory();
        bootstrap = new MessageQueueBootstrap(consumer, registry,
                new UserEventHandler(directory), new EmailNotificationHandler());
    }

    @Test
    void testSubscribesAndRegistersAllQueues() {
        Subscription<?> subscription = mock(Subscription.class);
        when(consumer.subscribe(anyString(), any(), any())).thenReturn((Subscription) subscription);

        bootstrap.startConsumers();

        verify(consumer).subscribe(eq(QueueNames.USER_CREATED), eq(UserCreatedMessage.class), any());
        verify(consumer).subscribe(eq(QueueNames.USER_UPDATED), eq(UserUpdatedMessage.class), any());
        verify(consumer).subscribe(eq(QueueNames.USER_DELETED), eq(UserDeletedMessage.class), any());
        verify(consumer).subscribe(eq(QueueNames.EMAIL_NOTIFICATION), eq(EmailNotificationMessage.class), any());
        verify(registry, times(4)).register(subscription);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUserCreatedHandlerIsWired() throws Exception {
        ArgumentCaptor<MessageHandler<UserCreatedMessage>> captor = ArgumentCaptor.forClass(MessageHandler.class);
        when(consumer.subscribe(anyString(), any(), any())).thenReturn((Subscription) mock(Subscription.class));

        bootstrap.startConsumers();

        verify(consumer).subscribe(eq(QueueNames.USER_CREATED), eq(UserCreatedMessage.class), captor.capture());
        assertTrue(captor.getValue().handle(new UserCreatedMessage(3, "Carol", "carol@example.com")));
        assertTrue(directory.find(3).isPresent());
    }
}
