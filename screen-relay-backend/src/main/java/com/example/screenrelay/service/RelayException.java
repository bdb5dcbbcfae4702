package com.example.screenrelay.service;

/**
 * A request that was rejected. The message is what the requesting session receives in its
 * {@code error} frame.
 */
public class RelayException extends RuntimeException {
    public RelayException(String message) {
        super(message);
    }
}
