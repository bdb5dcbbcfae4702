package com.example.screenrelay.client;

import com.example.screenrelay.negotiation.PeerRole;

public interface MediaSessionFactory {
    MediaSession open(String remotePeerId, PeerRole role);
}
