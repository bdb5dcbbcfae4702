package com.example.screenrelay.negotiation;

import com.example.screenrelay.signal.IceCandidate;

import java.util.ArrayList;
import java.util.List;

public record NegotiationState(
        String remotePeerId,
        PeerRole role,
        NegotiationPhase phase,
        boolean remoteDescriptionApplied,
        List<IceCandidate> pendingCandidates
) {
    public NegotiationState {
        pendingCandidates = List.copyOf(pendingCandidates);
    }

    public static NegotiationState initial(String remotePeerId, PeerRole role) {
        return new NegotiationState(remotePeerId, role, NegotiationPhase.IDLE, false, List.of());
    }

    public boolean isPolite() {
        return role == PeerRole.POLITE;
    }

    public boolean isClosed() {
        return phase == NegotiationPhase.CLOSED;
    }

    NegotiationState withPhase(NegotiationPhase next) {
        return new NegotiationState(remotePeerId, role, next, remoteDescriptionApplied, pendingCandidates);
    }

    NegotiationState remoteApplied(NegotiationPhase next) {
        return new NegotiationState(remotePeerId, role, next, true, List.of());
    }

    NegotiationState buffer(IceCandidate candidate) {
        List<IceCandidate> pending = new ArrayList<>(pendingCandidates);
        pending.add(candidate);
        return new NegotiationState(remotePeerId, role, phase, remoteDescriptionApplied, pending);
    }

    NegotiationState closed() {
        return new NegotiationState(remotePeerId, role, NegotiationPhase.CLOSED, remoteDescriptionApplied, List.of());
    }
}
