package com.example.screenrelay.negotiation;

/**
 * Fixed per pair. The stream initiator is impolite and wins offer collisions; the receiving
 * side is polite and yields.
 */
public enum PeerRole {
    POLITE,
    IMPOLITE;

    public static PeerRole forLocalSide(boolean localIsHost) {
        return localIsHost ? IMPOLITE : POLITE;
    }
}
