package com.example.screenrelay.service;

public class NotHostException extends RelayException {
    public NotHostException() {
        super("Only the host can control the stream");
    }
}
