package com.example.screenrelay.client;

/**
 * Receives connection-state updates for display. All methods are called with the client's lock held.
 */
public interface ConnectionStateListener {

    void onConnectionStateChanged(String peerId, PeerConnectionState state);

    default void onRestartBudgetExhausted(String peerId) {
    }

    default void onSessionEnded(String reason) {
    }

    default void onError(String message) {
    }
}
