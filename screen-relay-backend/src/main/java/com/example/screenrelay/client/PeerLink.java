package com.example.screenrelay.client;

import com.example.screenrelay.negotiation.NegotiationState;

class PeerLink {
    private final String peerId;
    private final MediaSession media;
    private NegotiationState state;

    PeerLink(String peerId, MediaSession media, NegotiationState state) {
        this.peerId = peerId;
        this.media = media;
        this.state = state;
    }

    String peerId() {
        return peerId;
    }

    MediaSession media() {
        return media;
    }

    NegotiationState state() {
        return state;
    }

    void state(NegotiationState next) {
        this.state = next;
    }
}
