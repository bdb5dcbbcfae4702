package com.example.screenrelay.service;

import com.example.screenrelay.model.CloseReason;
import com.example.screenrelay.model.Room;
import com.example.screenrelay.model.RoomSnapshot;
import com.example.screenrelay.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of every live room. All room mutations go through this class under the room's lock;
 * callers only ever see {@link RoomSnapshot}s.
 */
@Service
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);
    private static final int MAX_CODE_ATTEMPTS = 100;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final AtomicLong roomsCreated = new AtomicLong();
    private final SessionDirectory directory;
    private final RoomLocks locks;
    private final RoomCodeGenerator codeGenerator;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final int maxViewersCap;
    private final Duration idleTtl;

    public RoomRegistry(SessionDirectory directory,
                        RoomLocks locks,
                        RoomCodeGenerator codeGenerator,
                        ApplicationEventPublisher events,
                        Clock clock,
                        @Value("${relay.rooms.max-viewers:10}") int maxViewersCap,
                        @Value("${relay.rooms.idle-ttl-hours:12}") long idleTtlHours) {
        this.directory = directory;
        this.locks = locks;
        this.codeGenerator = codeGenerator;
        this.events = events;
        this.clock = clock;
        this.maxViewersCap = Math.max(1, maxViewersCap);
        this.idleTtl = Duration.ofHours(idleTtlHours);
    }

    /**
     * Creates a room for {@code hostId}. When {@code requestedCode} names a room whose host is
     * no longer connected, the caller takes that room over instead. A requested code held by a
     * connected host falls back to a generated code.
     */
    public RoomSnapshot createRoom(String hostId, String hostName, String requestedCode, Integer maxViewers) {
        int capacity = clampViewers(maxViewers);
        if (requestedCode != null) {
            String code = normalize(requestedCode);
            Optional<RoomSnapshot> claimed = locks.withRoom(code, () -> claim(code, hostId, hostName, capacity));
            if (claimed.isPresent()) {
                return claimed.get();
            }
        }
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.next();
            Optional<RoomSnapshot> created = locks.withRoom(code, () -> {
                Room room = new Room(code, hostId, hostName, capacity, clock.instant());
                if (rooms.putIfAbsent(code, room) != null) {
                    return Optional.empty();
                }
                roomsCreated.incrementAndGet();
                log.info("Room created: {} by {} (Total rooms: {})", code, hostName, rooms.size());
                return Optional.of(room.snapshot());
            });
            if (created.isPresent()) {
                return created.get();
            }
            log.debug("Room code collision on {}, retrying", code);
        }
        throw new IllegalStateException("Could not allocate a unique room code");
    }

    private Optional<RoomSnapshot> claim(String code, String hostId, String hostName, int capacity) {
        Room existing = rooms.get(code);
        if (existing == null) {
            Room room = new Room(code, hostId, hostName, capacity, clock.instant());
            existing = rooms.putIfAbsent(code, room);
            if (existing == null) {
                roomsCreated.incrementAndGet();
                log.info("Room created: {} by {} (Total rooms: {})", code, hostName, rooms.size());
                return Optional.of(room.snapshot());
            }
        }
        if (hostId.equals(existing.getHostId())) {
            return Optional.of(existing.snapshot());
        }
        if (!directory.isConnected(existing.getHostId())) {
            String previousHost = existing.getHostId();
            existing.assignHost(hostId, hostName, clock.instant());
            log.info("Host {} took over room {} (previous host {})", hostName, code, previousHost);
            return Optional.of(existing.snapshot());
        }
        log.info("Room {} is held by a connected host, allocating a fresh code for {}", code, hostName);
        return Optional.empty();
    }

    public RoomSnapshot joinRoom(String roomCode, User user) {
        String code = normalize(roomCode);
        return locks.withRoom(code, () -> {
            Room room = rooms.get(code);
            if (room == null) {
                log.warn("Attempted to join non-existent room: {}", code);
                throw new RoomNotFoundException();
            }
            if (user.id().equals(room.getHostId()) || room.hasViewer(user.id())) {
                return room.snapshot();
            }
            if (room.isFull()) {
                log.warn("Room {} is full ({}/{})", code, room.getViewerCount(), room.getMaxViewers());
                throw new RoomFullException();
            }
            room.addViewer(user, clock.instant());
            log.info("User {} joined room {} ({}/{})", user.name(), code, room.getViewerCount(), room.getMaxViewers());
            return room.snapshot();
        });
    }

    public LeaveOutcome leave(String roomCode, String userId) {
        return leave(roomCode, userId, CloseReason.HOST_LEFT);
    }

    /**
     * Removes {@code userId} from the room. A departing host closes the room: a
     * {@link RoomClosingEvent} carrying {@code hostReason} is published before the record goes away.
     */
    public LeaveOutcome leave(String roomCode, String userId, CloseReason hostReason) {
        String code = normalize(roomCode);
        return locks.withRoom(code, () -> {
            Room room = rooms.get(code);
            if (room == null) {
                return LeaveOutcome.notMember();
            }
            if (userId.equals(room.getHostId())) {
                RoomSnapshot closing = room.snapshot();
                log.info("Host left room {}, closing room", code);
                events.publishEvent(new RoomClosingEvent(closing, hostReason));
                rooms.remove(code);
                return new LeaveOutcome(LeaveOutcome.Kind.ROOM_CLOSED, closing);
            }
            if (!room.removeViewer(userId, clock.instant())) {
                return LeaveOutcome.notMember();
            }
            log.info("User removed from room {} ({} viewers remaining)", code, room.getViewerCount());
            RoomSnapshot after = room.snapshot();
            if (room.getViewerCount() == 0 && !room.isStreaming()) {
                rooms.remove(code);
                log.info("Room {} is empty, removing", code);
                return new LeaveOutcome(LeaveOutcome.Kind.ROOM_EMPTIED, after);
            }
            return new LeaveOutcome(LeaveOutcome.Kind.VIEWER_LEFT, after);
        });
    }

    /**
     * Reverts a join or create whose session went away before it was bound. Unlike
     * {@link #leave}, a viewer's withdrawal never tears down the room it empties.
     */
    public void withdraw(String roomCode, String userId) {
        String code = normalize(roomCode);
        locks.runInRoom(code, () -> {
            Room room = rooms.get(code);
            if (room == null) {
                return;
            }
            if (userId.equals(room.getHostId())) {
                leave(code, userId, CloseReason.HOST_DISCONNECTED);
            } else if (room.removeViewer(userId, clock.instant())) {
                log.info("Withdrew {} from room {} ({} viewers remaining)", userId, code, room.getViewerCount());
            }
        });
    }

    public RoomSnapshot setStreaming(String roomCode, String hostId, boolean streaming) {
        String code = normalize(roomCode);
        return locks.withRoom(code, () -> {
            Room room = rooms.get(code);
            if (room == null) {
                throw new RoomNotFoundException();
            }
            if (!hostId.equals(room.getHostId())) {
                throw new NotHostException();
            }
            room.setStreaming(streaming, clock.instant());
            log.info("Stream {} in room {}", streaming ? "started" : "stopped", code);
            return room.snapshot();
        });
    }

    /**
     * Removes rooms without viewers whose last activity is at least the idle TTL before
     * {@code now}. Rooms with viewers are never removed here.
     */
    public int sweep(Instant now) {
        int cleaned = 0;
        for (String code : new ArrayList<>(rooms.keySet())) {
            boolean removed = locks.withRoom(code, () -> {
                Room room = rooms.get(code);
                if (room == null || room.getViewerCount() > 0) {
                    return false;
                }
                if (room.getLastActivityAt().plus(idleTtl).isAfter(now)) {
                    return false;
                }
                events.publishEvent(new RoomClosingEvent(room.snapshot(), CloseReason.EXPIRED));
                rooms.remove(code);
                return true;
            });
            if (removed) {
                cleaned++;
            }
        }
        if (cleaned > 0) {
            log.info("Cleaned up {} stale rooms", cleaned);
        }
        return cleaned;
    }

    public Optional<RoomSnapshot> find(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        String code = normalize(roomCode);
        return locks.withRoom(code, () -> Optional.ofNullable(rooms.get(code)).map(Room::snapshot));
    }

    public List<RoomSnapshot> snapshots() {
        List<RoomSnapshot> result = new ArrayList<>();
        for (String code : new ArrayList<>(rooms.keySet())) {
            find(code).ifPresent(result::add);
        }
        result.sort(Comparator.comparing(RoomSnapshot::createdAt));
        return result;
    }

    public Set<String> codes() {
        return new TreeSet<>(rooms.keySet());
    }

    public int size() {
        return rooms.size();
    }

    public long roomsCreated() {
        return roomsCreated.get();
    }

    private int clampViewers(Integer requested) {
        if (requested == null) {
            return maxViewersCap;
        }
        return Math.max(1, Math.min(requested, maxViewersCap));
    }

    private static String normalize(String roomCode) {
        return roomCode.trim().toUpperCase(Locale.ROOT);
    }
}
