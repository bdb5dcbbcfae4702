package com.example.screenrelay.service;

public class RoomNotFoundException extends RelayException {
    public RoomNotFoundException() {
        super("Room not found");
    }
}
