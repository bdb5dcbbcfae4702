package com.example.screenrelay.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RoomSweeper {
    private final SessionSupervisor supervisor;

    public RoomSweeper(SessionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Scheduled(fixedDelayString = "${relay.rooms.sweep-interval-ms:3600000}",
            initialDelayString = "${relay.rooms.sweep-interval-ms:3600000}")
    public void sweep() {
        supervisor.sweepIdleRooms();
    }
}
