package com.example.screenrelay.signal;

public record IceCandidate(String candidate, String sdpMid, Integer sdpMLineIndex) {
}
