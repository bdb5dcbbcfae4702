package com.example.screenrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable view of a room at one point in time. This is also the payload of
 * {@code room:created} and {@code room:joined}.
 */
public record RoomSnapshot(
        String code,
        String hostId,
        String hostName,
        List<User> viewers,
        int viewerCount,
        int maxViewers,
        @JsonProperty("isStreaming") boolean isStreaming,
        Instant createdAt
) {
    public RoomSnapshot {
        viewers = List.copyOf(viewers);
    }

    /** Host first, then viewers in join order. */
    public List<String> memberIds() {
        List<String> ids = new ArrayList<>(viewers.size() + 1);
        if (hostId != null) {
            ids.add(hostId);
        }
        for (User viewer : viewers) {
            ids.add(viewer.id());
        }
        return ids;
    }

    public RoomUpdate toUpdate() {
        return new RoomUpdate(viewers, viewerCount);
    }
}
