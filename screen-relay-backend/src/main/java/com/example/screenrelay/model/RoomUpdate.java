package com.example.screenrelay.model;

import java.util.List;

public record RoomUpdate(List<User> viewers, int viewerCount) {
}
