package com.example.screenrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Payload of {@code room:joined}: the room as the joining viewer sees it. {@code you} is the
 * joiner's own record and {@code viewers} lists everybody else.
 */
public record JoinedRoom(
        String code,
        String hostId,
        String hostName,
        User you,
        List<User> viewers,
        int viewerCount,
        int maxViewers,
        @JsonProperty("isStreaming") boolean isStreaming,
        Instant createdAt
) {
    public static JoinedRoom of(RoomSnapshot room, User you) {
        List<User> others = room.viewers().stream()
                .filter(viewer -> !viewer.id().equals(you.id()))
                .toList();
        return new JoinedRoom(room.code(), room.hostId(), room.hostName(), you, others, others.size(),
                room.maxViewers(), room.isStreaming(), room.createdAt());
    }
}
