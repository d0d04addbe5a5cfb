package com.mqlab.userevents.domain;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory read model of known users, kept current from user lifecycle messages.
 * Every operation is an upsert or remove by id, so redelivered messages leave it unchanged.
 */
@Component
public class UserDirectory {

    private final Map<Long, UserView> users = new ConcurrentHashMap<>();

    public void put(UserView user) {
        users.put(user.userId(), user);
    }

    public Optional<UserView> find(long userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public boolean remove(long userId) {
        return users.remove(userId) != null;
    }

    public int size() {
        return users.size();
    }

    public record UserView(long userId, String name, String email) {
    }
}
