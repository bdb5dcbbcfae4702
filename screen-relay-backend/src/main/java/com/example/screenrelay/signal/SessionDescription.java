package com.example.screenrelay.signal;

import java.util.Objects;

public record SessionDescription(SignalKind kind, String sdp) {
    public SessionDescription {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isDescription()) {
            throw new IllegalArgumentException("Not a description kind: " + kind);
        }
    }

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(SignalKind.OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(SignalKind.ANSWER, sdp);
    }

    public boolean isOffer() {
        return kind == SignalKind.OFFER;
    }
}
