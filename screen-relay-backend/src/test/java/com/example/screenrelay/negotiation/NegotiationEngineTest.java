package com.example.screenrelay.negotiation;

import com.example.screenrelay.signal.IceCandidate;
import com.example.screenrelay.signal.SessionDescription;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.screenrelay.negotiation.NegotiationAction.Type.APPLY_CANDIDATE;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.APPLY_REMOTE_DESCRIPTION;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.CREATE_ANSWER;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.CREATE_OFFER;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.RELEASE;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.REQUEST_RESTART;
import static com.example.screenrelay.negotiation.NegotiationAction.Type.ROLLBACK_LOCAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NegotiationEngineTest {

    private final NegotiationEngine engine = new NegotiationEngine();

    private static final SessionDescription OFFER = SessionDescription.offer("remote-offer");
    private static final SessionDescription ANSWER = SessionDescription.answer("remote-answer");

    private static IceCandidate candidate(String value) {
        return new IceCandidate(value, "0", 0);
    }

    private static List<NegotiationAction.Type> types(Transition transition) {
        return transition.actions().stream().map(NegotiationAction::type).toList();
    }

    private static NegotiationState impolite() {
        return NegotiationState.initial("viewer", PeerRole.IMPOLITE);
    }

    private static NegotiationState polite() {
        return NegotiationState.initial("host", PeerRole.POLITE);
    }

    @Test
    void impoliteStartOffers() {
        Transition started = engine.start(impolite());

        assertThat(started.state().phase()).isEqualTo(NegotiationPhase.OFFERING);
        assertThat(types(started)).containsExactly(CREATE_OFFER);
        assertThat(started.actions().get(0).iceRestart()).isFalse();
    }

    @Test
    void politeSideCannotStart() {
        assertThatThrownBy(() -> engine.start(polite())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void startTwiceIsRejected() {
        NegotiationState offering = engine.start(impolite()).state();

        assertThatThrownBy(() -> engine.start(offering)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void offerAnswerCycleEndsStableOnBothSides() {
        Transition offered = engine.start(impolite());

        Transition answering = engine.onRemoteDescription(polite(), OFFER);
        assertThat(types(answering)).containsExactly(APPLY_REMOTE_DESCRIPTION, CREATE_ANSWER);
        assertThat(answering.state().phase()).isEqualTo(NegotiationPhase.ANSWERING);
        assertThat(engine.onLocalAnswerApplied(answering.state()).state().phase()).isEqualTo(NegotiationPhase.STABLE);

        Transition answered = engine.onRemoteDescription(offered.state(), ANSWER);
        assertThat(types(answered)).containsExactly(APPLY_REMOTE_DESCRIPTION);
        assertThat(answered.state().phase()).isEqualTo(NegotiationPhase.STABLE);
        assertThat(answered.state().remoteDescriptionApplied()).isTrue();
    }

    @Test
    void glareImpoliteIgnoresIncomingOffer() {
        NegotiationState offering = engine.start(impolite()).state();

        Transition collision = engine.onRemoteDescription(offering, OFFER);

        assertThat(collision.actions()).isEmpty();
        assertThat(collision.state()).isEqualTo(offering);
    }

    @Test
    void glarePoliteRollsBackAndAnswers() {
        NegotiationState offering = engine.renegotiate(stablePolite(), false).state();
        assertThat(offering.phase()).isEqualTo(NegotiationPhase.OFFERING);

        Transition collision = engine.onRemoteDescription(offering, OFFER);

        assertThat(types(collision)).containsExactly(ROLLBACK_LOCAL, APPLY_REMOTE_DESCRIPTION, CREATE_ANSWER);
        assertThat(collision.state().phase()).isEqualTo(NegotiationPhase.ANSWERING);
    }

    @Test
    void glareConvergesRegardlessOfArrivalOrder() {
        // both sides offer; each receives the other's offer, then the impolite side gets its answer
        NegotiationState host = engine.start(impolite()).state();
        NegotiationState viewer = engine.renegotiate(stablePolite(), false).state();

        Transition hostSeesOffer = engine.onRemoteDescription(host, OFFER);
        Transition viewerSeesOffer = engine.onRemoteDescription(viewer, OFFER);
        viewer = engine.onLocalAnswerApplied(viewerSeesOffer.state()).state();
        host = engine.onRemoteDescription(hostSeesOffer.state(), ANSWER).state();

        assertThat(host.phase()).isEqualTo(NegotiationPhase.STABLE);
        assertThat(viewer.phase()).isEqualTo(NegotiationPhase.STABLE);

        // reversed: the polite side handles the collision before the impolite side sees its offer
        NegotiationState host2 = engine.start(impolite()).state();
        NegotiationState viewer2 = engine.renegotiate(stablePolite(), false).state();
        viewer2 = engine.onLocalAnswerApplied(engine.onRemoteDescription(viewer2, OFFER).state()).state();
        Transition staleOffer = engine.onRemoteDescription(host2, OFFER);
        assertThat(staleOffer.actions()).isEmpty();
        host2 = engine.onRemoteDescription(staleOffer.state(), ANSWER).state();

        assertThat(viewer2.phase()).isEqualTo(NegotiationPhase.STABLE);
        assertThat(host2.phase()).isEqualTo(NegotiationPhase.STABLE);
    }

    @Test
    void candidatesBeforeRemoteDescriptionAreBufferedAndReplayedInOrder() {
        NegotiationState state = polite();
        state = engine.onRemoteCandidate(state, candidate("c1")).state();
        Transition second = engine.onRemoteCandidate(state, candidate("c2"));
        assertThat(second.actions()).isEmpty();
        assertThat(second.state().pendingCandidates()).extracting(IceCandidate::candidate).containsExactly("c1", "c2");

        Transition applied = engine.onRemoteDescription(second.state(), OFFER);

        assertThat(types(applied)).containsExactly(APPLY_REMOTE_DESCRIPTION, APPLY_CANDIDATE, APPLY_CANDIDATE, CREATE_ANSWER);
        assertThat(applied.actions().subList(1, 3)).extracting(a -> a.candidate().candidate()).containsExactly("c1", "c2");
        assertThat(applied.state().pendingCandidates()).isEmpty();

        Transition later = engine.onRemoteCandidate(applied.state(), candidate("c3"));
        assertThat(types(later)).containsExactly(APPLY_CANDIDATE);
    }

    @Test
    void impoliteSideDrainsBufferOnAnswer() {
        NegotiationState state = engine.start(impolite()).state();
        state = engine.onRemoteCandidate(state, candidate("c1")).state();

        Transition answered = engine.onRemoteDescription(state, ANSWER);

        assertThat(types(answered)).containsExactly(APPLY_REMOTE_DESCRIPTION, APPLY_CANDIDATE);
    }

    @Test
    void staleAnswerIsIgnored() {
        Transition stale = engine.onRemoteDescription(polite(), ANSWER);

        assertThat(stale.actions()).isEmpty();
        assertThat(stale.state().phase()).isEqualTo(NegotiationPhase.IDLE);
    }

    @Test
    void renegotiateOnlyFromStable() {
        assertThat(engine.renegotiate(impolite(), true).actions()).isEmpty();

        NegotiationState stable = engine.onRemoteDescription(engine.start(impolite()).state(), ANSWER).state();
        Transition restart = engine.renegotiate(stable, true);

        assertThat(types(restart)).containsExactly(CREATE_OFFER);
        assertThat(restart.actions().get(0).iceRestart()).isTrue();
    }

    @Test
    void connectivityFailureRequestsRestartWithoutChangingState() {
        NegotiationState stable = stablePolite();

        Transition failure = engine.onConnectivityFailure(stable);

        assertThat(types(failure)).containsExactly(REQUEST_RESTART);
        assertThat(failure.state()).isEqualTo(stable);
    }

    @Test
    void closeIsTerminalAndIdempotent() {
        NegotiationState buffered = engine.onRemoteCandidate(polite(), candidate("c1")).state();

        Transition closed = engine.close(buffered);
        assertThat(types(closed)).containsExactly(RELEASE);
        assertThat(closed.state().isClosed()).isTrue();
        assertThat(closed.state().pendingCandidates()).isEmpty();

        NegotiationState state = closed.state();
        assertThat(engine.close(state).actions()).isEmpty();
        assertThat(engine.onRemoteDescription(state, OFFER).actions()).isEmpty();
        assertThat(engine.onRemoteCandidate(state, candidate("c2")).state()).isEqualTo(state);
        assertThat(engine.onConnectivityFailure(state).actions()).isEmpty();
        assertThat(engine.renegotiate(state, true).actions()).isEmpty();
        assertThat(engine.start(NegotiationState.initial("x", PeerRole.IMPOLITE).closed()).actions()).isEmpty();
    }

    private NegotiationState stablePolite() {
        Transition answering = engine.onRemoteDescription(polite(), OFFER);
        return engine.onLocalAnswerApplied(answering.state()).state();
    }
}
