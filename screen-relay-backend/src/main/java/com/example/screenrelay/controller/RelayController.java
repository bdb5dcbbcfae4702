package com.example.screenrelay.controller;

import com.example.screenrelay.model.RoomSnapshot;
import com.example.screenrelay.model.User;
import com.example.screenrelay.service.ConnectionStats;
import com.example.screenrelay.service.InvalidInputException;
import com.example.screenrelay.service.RoomNotFoundException;
import com.example.screenrelay.service.RoomRegistry;
import com.example.screenrelay.service.SessionDirectory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Read-only operational views over the registry: liveness, statistics and a per-room snapshot.
 */
@RestController
public class RelayController {
    private static final Pattern ROOM_CODE = Pattern.compile("[A-Za-z0-9]{1,10}");

    private final RoomRegistry registry;
    private final SessionDirectory directory;
    private final ConnectionStats stats;
    private final Clock clock;
    private final Instant startedAt;

    public RelayController(RoomRegistry registry, SessionDirectory directory, ConnectionStats stats, Clock clock) {
        this.registry = registry;
        this.directory = directory;
        this.stats = stats;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/")
    public ResponseEntity<?> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "Screen Relay Signaling Server");
        body.put("status", "running");
        body.put("health", "/health");
        body.put("stats", "/stats");
        body.put("rooms", registry.size());
        body.put("users", directory.userCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Runtime runtime = Runtime.getRuntime();
        Instant now = clock.instant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", now.toString());
        body.put("uptime", Duration.between(startedAt, now).toSeconds());
        body.put("memory", Map.of(
                "heapUsed", runtime.totalMemory() - runtime.freeMemory(),
                "heapTotal", runtime.totalMemory(),
                "heapMax", runtime.maxMemory()));
        body.put("connections", directory.connectionCount());
        body.put("rooms", registry.size());
        body.put("users", directory.userCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        ConnectionStats.Snapshot connections = stats.snapshot();
        List<Map<String, Object>> rooms = registry.snapshots().stream()
                .map(RelayController::describeRoom)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalConnections", connections.totalConnections());
        body.put("currentConnections", connections.currentConnections());
        body.put("peakConnections", connections.peakConnections());
        body.put("roomsCreated", registry.roomsCreated());
        body.put("currentRooms", registry.size());
        body.put("currentUsers", directory.userCount());
        body.put("activeRoomCodes", registry.codes());
        body.put("rooms", rooms);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/room/{code}")
    public ResponseEntity<?> room(@PathVariable String code) {
        if (!ROOM_CODE.matcher(code).matches()) {
            throw new InvalidInputException("Invalid room code");
        }
        RoomSnapshot room = registry.find(code).orElseThrow(RoomNotFoundException::new);
        List<String> connected = room.memberIds().stream()
                .filter(directory::isConnected)
                .toList();
        return ResponseEntity.ok(Map.of("room", room, "connectedSessions", connected));
    }

    private static Map<String, Object> describeRoom(RoomSnapshot room) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("code", room.code());
        entry.put("hostId", room.hostId());
        entry.put("hostName", room.hostName());
        entry.put("viewers", room.viewerCount());
        entry.put("viewerList", room.viewers().stream()
                .map(RelayController::describeViewer)
                .toList());
        entry.put("maxViewers", room.maxViewers());
        entry.put("isStreaming", room.isStreaming());
        entry.put("createdAt", room.createdAt());
        return entry;
    }

    private static Map<String, Object> describeViewer(User viewer) {
        return Map.of("id", viewer.id(), "name", viewer.name());
    }
}
