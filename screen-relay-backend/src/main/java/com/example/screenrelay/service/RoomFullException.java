package com.example.screenrelay.service;

public class RoomFullException extends RelayException {
    public RoomFullException() {
        super("Room is full");
    }
}
