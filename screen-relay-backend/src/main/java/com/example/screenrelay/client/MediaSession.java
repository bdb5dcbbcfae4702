package com.example.screenrelay.client;

import com.example.screenrelay.signal.IceCandidate;
import com.example.screenrelay.signal.SessionDescription;

/**
 * The local end of one peer connection, provided by the media stack. Implementations report
 * local ICE candidates and connection-state changes back through
 * {@link PeerSignalingClient#onLocalCandidate} and {@link PeerSignalingClient#onConnectionStateChange}.
 */
public interface MediaSession {

    /** Creates an offer and applies it as the local description. */
    SessionDescription createOffer(boolean iceRestart);

    /** Creates an answer to the applied remote offer and applies it as the local description. */
    SessionDescription createAnswer();

    void rollbackLocalDescription();

    void setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate);

    void close();
}
