package com.example.screenrelay.negotiation;

import com.example.screenrelay.signal.IceCandidate;
import com.example.screenrelay.signal.SessionDescription;

/**
 * Side effect requested by a transition. The caller executes actions in list order.
 */
public record NegotiationAction(Type type, SessionDescription description, IceCandidate candidate, boolean iceRestart) {

    public enum Type {
        CREATE_OFFER,
        ROLLBACK_LOCAL,
        APPLY_REMOTE_DESCRIPTION,
        APPLY_CANDIDATE,
        /** Create a local answer, apply it locally, send it, then report it applied. */
        CREATE_ANSWER,
        /** Connectivity failed; the caller decides whether to renegotiate with an ICE restart. */
        REQUEST_RESTART,
        RELEASE
    }

    public static NegotiationAction createOffer(boolean iceRestart) {
        return new NegotiationAction(Type.CREATE_OFFER, null, null, iceRestart);
    }

    public static NegotiationAction rollbackLocal() {
        return new NegotiationAction(Type.ROLLBACK_LOCAL, null, null, false);
    }

    public static NegotiationAction applyRemote(SessionDescription description) {
        return new NegotiationAction(Type.APPLY_REMOTE_DESCRIPTION, description, null, false);
    }

    public static NegotiationAction applyCandidate(IceCandidate candidate) {
        return new NegotiationAction(Type.APPLY_CANDIDATE, null, candidate, false);
    }

    public static NegotiationAction createAnswer() {
        return new NegotiationAction(Type.CREATE_ANSWER, null, null, false);
    }

    public static NegotiationAction requestRestart() {
        return new NegotiationAction(Type.REQUEST_RESTART, null, null, true);
    }

    public static NegotiationAction release() {
        return new NegotiationAction(Type.RELEASE, null, null, false);
    }
}
