package com.example.screenrelay.negotiation;

import com.example.screenrelay.signal.IceCandidate;
import com.example.screenrelay.signal.SessionDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Offer/answer state machine for one peer pair, written as pure functions: each call takes the
 * current state and one event and returns the next state plus the actions the caller must
 * carry out. The engine performs no I/O.
 *
 * <p>Offer collisions are settled by role. The impolite side ignores an offer that arrives
 * while its own offer is outstanding; the polite side rolls its offer back and answers the
 * incoming one. Candidates that arrive before any remote description are held back and
 * replayed in receipt order right after the first remote description is applied.
 *
 * <p>Once closed, every further event yields an unchanged state and no actions.
 */
public class NegotiationEngine {

    /**
     * First offer of the pair. Only the impolite side starts, and only from {@link NegotiationPhase#IDLE}.
     *
     * @throws IllegalStateException when called on the polite side or outside IDLE
     */
    public Transition start(NegotiationState state) {
        if (state.isClosed()) {
            return Transition.unchanged(state);
        }
        if (state.isPolite()) {
            throw new IllegalStateException("Polite peer cannot start negotiation with " + state.remotePeerId());
        }
        if (state.phase() != NegotiationPhase.IDLE) {
            throw new IllegalStateException("Negotiation with " + state.remotePeerId() + " already " + state.phase());
        }
        return Transition.of(state.withPhase(NegotiationPhase.OFFERING), NegotiationAction.createOffer(false));
    }

    /**
     * New offer on an established pair, from either side. Ignored unless the pair is
     * {@link NegotiationPhase#STABLE}; a negotiation already in flight carries the change.
     */
    public Transition renegotiate(NegotiationState state, boolean iceRestart) {
        if (state.phase() != NegotiationPhase.STABLE) {
            return Transition.unchanged(state);
        }
        return Transition.of(state.withPhase(NegotiationPhase.OFFERING), NegotiationAction.createOffer(iceRestart));
    }

    public Transition onRemoteDescription(NegotiationState state, SessionDescription description) {
        if (state.isClosed()) {
            return Transition.unchanged(state);
        }
        if (description.isOffer()) {
            return onRemoteOffer(state, description);
        }
        if (state.phase() != NegotiationPhase.OFFERING) {
            // answer to an offer we no longer have outstanding
            return Transition.unchanged(state);
        }
        List<NegotiationAction> actions = new ArrayList<>();
        actions.add(NegotiationAction.applyRemote(description));
        drain(state, actions);
        return new Transition(state.remoteApplied(NegotiationPhase.STABLE), actions);
    }

    private Transition onRemoteOffer(NegotiationState state, SessionDescription offer) {
        boolean collision = state.phase() == NegotiationPhase.OFFERING;
        if (collision && !state.isPolite()) {
            return Transition.unchanged(state);
        }
        List<NegotiationAction> actions = new ArrayList<>();
        if (collision) {
            actions.add(NegotiationAction.rollbackLocal());
        }
        actions.add(NegotiationAction.applyRemote(offer));
        drain(state, actions);
        actions.add(NegotiationAction.createAnswer());
        return new Transition(state.remoteApplied(NegotiationPhase.ANSWERING), actions);
    }

    /** The answer produced for a remote offer has been applied locally and sent. */
    public Transition onLocalAnswerApplied(NegotiationState state) {
        if (state.phase() != NegotiationPhase.ANSWERING) {
            return Transition.unchanged(state);
        }
        return Transition.unchanged(state.withPhase(NegotiationPhase.STABLE));
    }

    public Transition onRemoteCandidate(NegotiationState state, IceCandidate candidate) {
        if (state.isClosed()) {
            return Transition.unchanged(state);
        }
        if (!state.remoteDescriptionApplied()) {
            return Transition.unchanged(state.buffer(candidate));
        }
        return Transition.of(state, NegotiationAction.applyCandidate(candidate));
    }

    /**
     * The transport gave up on the pair. The engine only surfaces the failure; whether and how
     * often to restart is the caller's policy.
     */
    public Transition onConnectivityFailure(NegotiationState state) {
        if (state.isClosed()) {
            return Transition.unchanged(state);
        }
        return Transition.of(state, NegotiationAction.requestRestart());
    }

    public Transition close(NegotiationState state) {
        if (state.isClosed()) {
            return Transition.unchanged(state);
        }
        return Transition.of(state.closed(), NegotiationAction.release());
    }

    private static void drain(NegotiationState state, List<NegotiationAction> actions) {
        for (IceCandidate candidate : state.pendingCandidates()) {
            actions.add(NegotiationAction.applyCandidate(candidate));
        }
    }
}
