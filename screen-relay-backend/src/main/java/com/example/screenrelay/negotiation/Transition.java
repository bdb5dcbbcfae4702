package com.example.screenrelay.negotiation;

import java.util.List;

public record Transition(NegotiationState state, List<NegotiationAction> actions) {
    public Transition {
        actions = List.copyOf(actions);
    }

    public static Transition of(NegotiationState state, NegotiationAction... actions) {
        return new Transition(state, List.of(actions));
    }

    public static Transition unchanged(NegotiationState state) {
        return new Transition(state, List.of());
    }
}
