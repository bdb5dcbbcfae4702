package com.example.screenrelay.service;

import com.example.screenrelay.model.CloseReason;
import com.example.screenrelay.model.RoomSnapshot;

public record RoomClosingEvent(RoomSnapshot room, CloseReason reason) {
}
