package com.example.screenrelay.model;

public enum CloseReason {
    HOST_LEFT(RelayEvent.ROOM_CLOSED, "Host has left the room"),
    HOST_DISCONNECTED(RelayEvent.HOST_DISCONNECTED, "Host has disconnected"),
    EXPIRED(RelayEvent.ROOM_CLOSED, "Room expired");

    private final RelayEvent notice;
    private final String message;

    CloseReason(RelayEvent notice, String message) {
        this.notice = notice;
        this.message = message;
    }

    public RelayEvent notice() {
        return notice;
    }

    public String message() {
        return message;
    }

    public boolean hostDeparted() {
        return this != EXPIRED;
    }
}
