package com.example.screenrelay.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Room {
    private final String code;
    private final int maxViewers;
    private final Instant createdAt;
    private final Map<String, User> viewers = new LinkedHashMap<>();
    private String hostId;
    private String hostName;
    private boolean streaming;
    private Instant lastActivityAt;

    public Room(String code, String hostId, String hostName, int maxViewers, Instant createdAt) {
        this.code = code;
        this.hostId = hostId;
        this.hostName = hostName;
        this.maxViewers = maxViewers;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public String getCode() { return code; }
    public String getHostId() { return hostId; }
    public String getHostName() { return hostName; }
    public int getMaxViewers() { return maxViewers; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public boolean isStreaming() { return streaming; }

    public int getViewerCount() {
        return viewers.size();
    }

    public boolean hasViewer(String userId) {
        return viewers.containsKey(userId);
    }

    public boolean isFull() {
        return viewers.size() >= maxViewers;
    }

    public void assignHost(String hostId, String hostName, Instant at) {
        this.hostId = hostId;
        this.hostName = hostName;
        touch(at);
    }

    public void addViewer(User user, Instant at) {
        viewers.putIfAbsent(user.id(), user);
        touch(at);
    }

    public boolean removeViewer(String userId, Instant at) {
        boolean removed = viewers.remove(userId) != null;
        if (removed) {
            touch(at);
        }
        return removed;
    }

    public void setStreaming(boolean streaming, Instant at) {
        this.streaming = streaming;
        touch(at);
    }

    private void touch(Instant at) {
        if (at != null && at.isAfter(lastActivityAt)) {
            lastActivityAt = at;
        }
    }

    public RoomSnapshot snapshot() {
        List<User> viewerList = List.copyOf(viewers.values());
        return new RoomSnapshot(code, hostId, hostName, viewerList, viewerList.size(), maxViewers,
                streaming, createdAt);
    }
}
