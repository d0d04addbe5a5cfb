package com.mqlab.userevents.messaging.handler;

import com.mqlab.common.message.UserCreatedMessage;
import com.mqlab.common.message.UserDeletedMessage;
import com.mqlab.common.message.UserUpdatedMessage;
import com.mqlab.userevents.domain.UserDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserEventHandlerTest {

    private UserDirectory directory;
    private UserEventHandler handler;

    @BeforeEach
    void setUp() {
        directory = new UserDirectory();
        handler = new UserEventHandler(directory);
    }

    @Test
    void testCreatedAddsUser() {
        assertTrue(handler.handleUserCreated(new UserCreatedMessage(7, "Alice", "alice@example.com")));

        assertEquals("alice@example.com", directory.find(7).orElseThrow().email());
    }

    @Test
    void testUpdatedReplacesUser() {
        handler.handleUserCreated(new UserCreatedMessage(7, "Alice", "alice@example.com"));

        assertTrue(handler.handleUserUpdated(
                new UserUpdatedMessage(7, "Alice B", "alice.b@example.com", Map.of("name", "Alice B"))));

        assertEquals("Alice B", directory.find(7).orElseThrow().name());
        assertEquals(1, directory.size());
    }

    @Test
    void testDeletedIsIdempotent() {
        handler.handleUserCreated(new UserCreatedMessage(7, "Alice", "alice@example.com"));

        assertTrue(handler.handleUserDeleted(new UserDeletedMessage(7, "alice@example.com")));
        assertTrue(handler.handleUserDeleted(new UserDeletedMessage(7, "alice@example.com")));
        assertTrue(directory.find(7).isEmpty());
    }

    @Test
    void testInvalidUserIdFails() {
        assertFalse(handler.handleUserCreated(new UserCreatedMessage(0, "Nobody", "n@example.com")));
        assertFalse(handler.handleUserUpdated(new UserUpdatedMessage(-1, "Nobody", "n@example.com", null)));
        assertFalse(handler.handleUserDeleted(new UserDeletedMessage(0, "n@example.com")));
        assertEquals(0, directory.size());
    }
}
