package com.example.screenrelay.signal;

import com.example.screenrelay.model.RelayEvent;

public enum SignalKind {
    OFFER("offer", RelayEvent.WEBRTC_OFFER),
    ANSWER("answer", RelayEvent.WEBRTC_ANSWER),
    ICE_CANDIDATE("ice-candidate", RelayEvent.WEBRTC_ICE_CANDIDATE);

    private final String wireName;
    private final RelayEvent event;

    SignalKind(String wireName, RelayEvent event) {
        this.wireName = wireName;
        this.event = event;
    }

    public String wireName() {
        return wireName;
    }

    public RelayEvent event() {
        return event;
    }

    public boolean isDescription() {
        return this != ICE_CANDIDATE;
    }

    public static SignalKind fromWireName(String raw) {
        if (raw != null) {
            for (SignalKind value : values()) {
                if (value.wireName.equalsIgnoreCase(raw)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown signal kind: " + raw);
    }
}
