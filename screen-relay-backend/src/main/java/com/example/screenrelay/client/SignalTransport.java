package com.example.screenrelay.client;

/**
 * Client side of the relay connection. {@code message} is one of the inbound protocol names,
 * such as {@code webrtc:offer} or {@code room:leave}.
 */
public interface SignalTransport {
    void send(String message, Object payload);
}
