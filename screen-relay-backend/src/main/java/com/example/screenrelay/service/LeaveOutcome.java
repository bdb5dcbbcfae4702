package com.example.screenrelay.service;

import com.example.screenrelay.model.RoomSnapshot;

public record LeaveOutcome(Kind kind, RoomSnapshot room) {

    public enum Kind {
        NOT_MEMBER,
        VIEWER_LEFT,
        /** Last viewer left a room that is not streaming; the room was removed without notice. */
        ROOM_EMPTIED,
        ROOM_CLOSED
    }

    static LeaveOutcome notMember() {
        return new LeaveOutcome(Kind.NOT_MEMBER, null);
    }

    public boolean roomRemoved() {
        return kind == Kind.ROOM_EMPTIED || kind == Kind.ROOM_CLOSED;
    }
}
