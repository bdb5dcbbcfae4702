package com.example.screenrelay.negotiation;

public enum NegotiationPhase {
    IDLE,
    /** A local offer is outstanding. */
    OFFERING,
    /** A remote offer was applied and the local answer is being produced. */
    ANSWERING,
    STABLE,
    CLOSED
}
