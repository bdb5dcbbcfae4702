package com.example.screenrelay.model;

public enum RelayEvent {
    ROOM_CREATED("room:created"),
    ROOM_JOINED("room:joined"),
    ROOM_UPDATED("room:updated"),
    ROOM_CLOSED("room:closed"),
    HOST_DISCONNECTED("host:disconnected"),
    USER_JOINED("user:joined"),
    USER_LEFT("user:left"),
    CHAT_MESSAGE("chat:message"),
    STREAM_STARTED("stream:started"),
    STREAM_STOPPED("stream:stopped"),
    WEBRTC_OFFER("webrtc:offer"),
    WEBRTC_ANSWER("webrtc:answer"),
    WEBRTC_ICE_CANDIDATE("webrtc:ice-candidate"),
    ERROR("error");

    private final String wireName;

    RelayEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RelayEvent fromWireName(String raw) {
        for (RelayEvent value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown relay event: " + raw);
    }
}
