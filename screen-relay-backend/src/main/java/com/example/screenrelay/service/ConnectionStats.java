package com.example.screenrelay.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class ConnectionStats {
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong currentConnections = new AtomicLong();
    private final AtomicLong peakConnections = new AtomicLong();

    public record Snapshot(long totalConnections, long currentConnections, long peakConnections) {
    }

    public long connected() {
        totalConnections.incrementAndGet();
        long current = currentConnections.incrementAndGet();
        peakConnections.accumulateAndGet(current, Math::max);
        return current;
    }

    public long disconnected() {
        return currentConnections.updateAndGet(current -> Math.max(0, current - 1));
    }

    public Snapshot snapshot() {
        return new Snapshot(totalConnections.get(), currentConnections.get(), peakConnections.get());
    }
}
