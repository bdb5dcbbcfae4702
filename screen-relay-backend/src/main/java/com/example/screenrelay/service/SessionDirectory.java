package com.example.screenrelay.service;

import com.example.screenrelay.model.User;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live transport sessions and what each one is bound to: its user record and the room it
 * has joined (at most one).
 */
@Component
public class SessionDirectory {

    public record Binding(User user, String roomCode) {
        static final Binding EMPTY = new Binding(null, null);
    }

    private final Map<String, Binding> sessions = new ConcurrentHashMap<>();

    public void register(String sessionId) {
        sessions.putIfAbsent(sessionId, Binding.EMPTY);
    }

    public Optional<Binding> unregister(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public boolean isConnected(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public Optional<User> user(String sessionId) {
        Binding binding = sessions.get(sessionId);
        return binding == null ? Optional.empty() : Optional.ofNullable(binding.user());
    }

    public Optional<String> roomOf(String sessionId) {
        Binding binding = sessions.get(sessionId);
        return binding == null ? Optional.empty() : Optional.ofNullable(binding.roomCode());
    }

    /** No-op for sessions that are no longer connected. */
    public void bind(String sessionId, User user, String roomCode) {
        sessions.computeIfPresent(sessionId, (id, current) -> new Binding(user, roomCode));
    }

    /** Detaches the session from {@code roomCode}; the user record is kept. */
    public void clearRoom(String sessionId, String roomCode) {
        sessions.computeIfPresent(sessionId, (id, current) ->
                roomCode.equals(current.roomCode()) ? new Binding(current.user(), null) : current);
    }

    public void unbind(String sessionId) {
        sessions.computeIfPresent(sessionId, (id, current) -> Binding.EMPTY);
    }

    public int connectionCount() {
        return sessions.size();
    }

    public int userCount() {
        return (int) sessions.values().stream().filter(b -> b.user() != null).count();
    }
}
