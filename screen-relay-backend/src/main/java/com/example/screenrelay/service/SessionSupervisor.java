package com.example.screenrelay.service;

import com.example.screenrelay.model.ChatMessage;
import com.example.screenrelay.model.CloseReason;
import com.example.screenrelay.model.CreateRoomRequest;
import com.example.screenrelay.model.JoinRoomRequest;
import com.example.screenrelay.model.JoinedRoom;
import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.RoomSnapshot;
import com.example.screenrelay.model.User;
import com.example.screenrelay.signal.SignalEnvelope;
import com.example.screenrelay.signal.SignalEnvelopeCodec;
import com.example.screenrelay.signal.SignalKind;
import com.example.screenrelay.signal.SignalRequest;
import com.example.screenrelay.util.Inputs;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds transport sessions to users and turns every inbound message into registry and router
 * calls. Failures are reported to the requesting session only.
 */
@Service
public class SessionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(SessionSupervisor.class);

    private final RoomRegistry registry;
    private final RelayRouter router;
    private final SessionDirectory directory;
    private final RoomLocks locks;
    private final SignalEnvelopeCodec codec;
    private final ConnectionStats stats;
    private final Validator validator;
    private final Clock clock;
    private final int maxChatLength;

    public SessionSupervisor(RoomRegistry registry,
                             RelayRouter router,
                             SessionDirectory directory,
                             RoomLocks locks,
                             SignalEnvelopeCodec codec,
                             ConnectionStats stats,
                             Validator validator,
                             Clock clock,
                             @Value("${relay.chat.max-length:500}") int maxChatLength) {
        this.registry = registry;
        this.router = router;
        this.directory = directory;
        this.locks = locks;
        this.codec = codec;
        this.stats = stats;
        this.validator = validator;
        this.clock = clock;
        this.maxChatLength = maxChatLength;
    }

    public void connect(String sessionId) {
        directory.register(sessionId);
        long active = stats.connected();
        log.info("[SOCKET] User connected: {} (Active: {})", sessionId, active);
    }

    /**
     * Tears down everything the session participates in. The session is unregistered first, so
     * signals still in flight towards it are dropped by the router.
     */
    public void disconnect(String sessionId, String reason) {
        Optional<SessionDirectory.Binding> binding = directory.unregister(sessionId);
        if (binding.isEmpty()) {
            return;
        }
        long active = stats.disconnected();
        log.info("[SOCKET] User disconnected: {} (Reason: {}, Active: {})", sessionId, reason, active);
        SessionDirectory.Binding bound = binding.get();
        if (bound.roomCode() == null) {
            return;
        }
        try {
            leaveRoom(sessionId, bound.roomCode(), CloseReason.HOST_DISCONNECTED);
        } catch (RuntimeException e) {
            log.error("Error handling disconnect for {}", sessionId, e);
        }
    }

    public void createRoom(String sessionId, CreateRoomRequest request) {
        guarded(sessionId, "create room", () -> {
            validate(request, "Invalid host name");
            String hostName = cleanName(request.hostName(), "Invalid host name");
            String code = Inputs.isBlank(request.roomCode()) ? null : Inputs.roomCode(request.roomCode());
            Optional<String> previous = directory.roomOf(sessionId);
            boolean alreadyHosting = previous.isPresent() && previous.get().equals(code)
                    && directory.user(sessionId).map(User::isHost).orElse(false);
            if (previous.isPresent() && !alreadyHosting) {
                leaveRoom(sessionId, previous.get(), CloseReason.HOST_LEFT);
            }
            User host = new User(sessionId, hostName, true, clock.instant());
            String created = registry.createRoom(sessionId, hostName, code, request.maxViewers()).code();
            locks.runInRoom(created, () -> announceCreated(host, created));
        });
    }

    private void announceCreated(User host, String code) {
        Optional<RoomSnapshot> room = registry.find(code).filter(r -> host.id().equals(r.hostId()));
        if (room.isEmpty()) {
            log.debug("Room {} changed hands before {} was bound to it", code, host.id());
            return;
        }
        directory.bind(host.id(), host, code);
        if (releaseIfGone(host.id(), code)) {
            return;
        }
        log.info("[ROOM] Created room {} with host {} ({})", code, host.name(), host.id());
        router.send(host.id(), RelayEvent.ROOM_CREATED, room.get());
    }

    /**
     * A disconnect that ran before the session was bound found nothing to clean up. Undo the
     * registry change here instead; must be called under the room's lock, after binding.
     */
    private boolean releaseIfGone(String sessionId, String code) {
        if (directory.isConnected(sessionId)) {
            return false;
        }
        log.info("[ROOM] Session {} disconnected while entering room {}, rolling back", sessionId, code);
        registry.withdraw(code, sessionId);
        return true;
    }

    public void joinRoom(String sessionId, JoinRoomRequest request) {
        guarded(sessionId, "join room", () -> {
            validate(request, "Invalid room code or name");
            String userName = cleanName(request.userName(), "Invalid room code or name");
            String code = Inputs.roomCode(request.roomCode());
            log.info("[ROOM] User {} ({}) attempting to join room {}", userName, sessionId, code);

            Optional<String> previous = directory.roomOf(sessionId);
            if (previous.isPresent() && !previous.get().equals(code)) {
                leaveRoom(sessionId, previous.get(), CloseReason.HOST_LEFT);
            }
            boolean rejoin = previous.filter(code::equals).isPresent();

            locks.runInRoom(code, () -> {
                RoomSnapshot room = registry.joinRoom(code, new User(sessionId, userName, false, clock.instant()));
                User user = room.viewers().stream()
                        .filter(viewer -> viewer.id().equals(sessionId))
                        .findFirst()
                        .orElseGet(() -> new User(sessionId, userName, sessionId.equals(room.hostId()), clock.instant()));
                directory.bind(sessionId, user, code);
                if (releaseIfGone(sessionId, code)) {
                    return;
                }
                router.send(sessionId, RelayEvent.ROOM_JOINED, JoinedRoom.of(room, user));
                if (rejoin || user.isHost()) {
                    return;
                }
                router.broadcast(room, RelayEvent.ROOM_UPDATED, room.toUpdate(), null);
                router.broadcast(room, RelayEvent.USER_JOINED, user, sessionId);
            });
        });
    }

    public void leaveRoom(String sessionId) {
        guarded(sessionId, "leave room", () -> {
            directory.roomOf(sessionId).ifPresent(code -> leaveRoom(sessionId, code, CloseReason.HOST_LEFT));
            directory.unbind(sessionId);
        });
    }

    private void leaveRoom(String sessionId, String code, CloseReason hostReason) {
        locks.runInRoom(code, () -> {
            LeaveOutcome outcome = registry.leave(code, sessionId, hostReason);
            if (outcome.kind() == LeaveOutcome.Kind.VIEWER_LEFT) {
                router.broadcast(outcome.room(), RelayEvent.USER_LEFT, sessionId, sessionId);
                router.broadcast(outcome.room(), RelayEvent.ROOM_UPDATED, outcome.room().toUpdate(), sessionId);
            } else if (outcome.kind() == LeaveOutcome.Kind.ROOM_EMPTIED) {
                router.broadcast(outcome.room(), RelayEvent.USER_LEFT, sessionId, sessionId);
            }
            directory.clearRoom(sessionId, code);
        });
    }

    public void chat(String sessionId, String message) {
        guarded(sessionId, "send message", () -> {
            Optional<User> sender = directory.user(sessionId);
            Optional<String> code = directory.roomOf(sessionId);
            Optional<String> text = Inputs.chatMessage(message, maxChatLength);
            if (sender.isEmpty() || code.isEmpty() || text.isEmpty()) {
                log.debug("Ignoring chat message from {}", sessionId);
                return;
            }
            ChatMessage chat = new ChatMessage(UUID.randomUUID().toString(), sessionId, sender.get().name(),
                    text.get(), clock.instant());
            locks.runInRoom(code.get(), () ->
                    router.broadcast(code.get(), RelayEvent.CHAT_MESSAGE, chat, sessionId));
        });
    }

    public void relaySignal(String sessionId, SignalKind kind, SignalRequest request) {
        guarded(sessionId, "relay " + kind.wireName(), () -> {
            SignalEnvelope envelope = codec.fromClient(kind, sessionId, request);
            Optional<String> code = directory.roomOf(sessionId);
            if (code.isEmpty()) {
                log.debug("[WebRTC] Dropping {} from {}: sender is not in a room", kind.wireName(), sessionId);
                return;
            }
            locks.runInRoom(code.get(), () -> router.route(envelope));
        });
    }

    public void startStream(String sessionId) {
        setStreaming(sessionId, true);
    }

    public void stopStream(String sessionId) {
        setStreaming(sessionId, false);
    }

    private void setStreaming(String sessionId, boolean streaming) {
        guarded(sessionId, streaming ? "start stream" : "stop stream", () -> {
            Optional<String> code = directory.roomOf(sessionId);
            if (code.isEmpty()) {
                log.debug("Ignoring stream toggle from {}: not in a room", sessionId);
                return;
            }
            locks.runInRoom(code.get(), () -> {
                RoomSnapshot room = registry.setStreaming(code.get(), sessionId, streaming);
                router.broadcast(room, streaming ? RelayEvent.STREAM_STARTED : RelayEvent.STREAM_STOPPED,
                        null, sessionId);
            });
        });
    }

    /** Answers a message whose payload could not be read at all. */
    public void rejectUnreadable(String sessionId, String destination, Exception cause) {
        guarded(sessionId, "read " + destination, () -> {
            throw new InvalidInputException("Invalid input");
        });
        log.debug("Unreadable payload on {} from {}: {}", destination, sessionId, cause.getMessage());
    }

    public int sweepIdleRooms() {
        return registry.sweep(clock.instant());
    }

    private void guarded(String sessionId, String action, Runnable handler) {
        if (!directory.isConnected(sessionId)) {
            log.debug("Ignoring {} from unknown session {}", action, sessionId);
            return;
        }
        try {
            handler.run();
        } catch (RelayException e) {
            log.info("Rejected {} from {}: {}", action, sessionId, e.getMessage());
            router.sendError(sessionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error trying to {} for {}", action, sessionId, e);
            router.sendError(sessionId, "Failed to " + action);
        }
    }

    private void validate(Object request, String message) {
        if (request == null || !validator.validate(request).isEmpty()) {
            throw new InvalidInputException(message);
        }
    }

    private static String cleanName(String raw, String message) {
        String name = Inputs.displayName(raw);
        if (name.isEmpty()) {
            throw new InvalidInputException(message);
        }
        return name;
    }
}
