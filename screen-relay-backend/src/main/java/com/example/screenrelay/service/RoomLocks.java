package com.example.screenrelay.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes all work on one room. Rooms hash onto a fixed set of reentrant stripes, so
 * unrelated rooms proceed in parallel. Callers never hold two room locks at once.
 */
@Component
public class RoomLocks {
    static final int STRIPES = 64;

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public RoomLocks() {
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withRoom(String roomCode, Supplier<T> action) {
        ReentrantLock lock = stripeFor(roomCode);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runInRoom(String roomCode, Runnable action) {
        withRoom(roomCode, () -> {
            action.run();
            return null;
        });
    }

    private ReentrantLock stripeFor(String roomCode) {
        return stripes[stripeOf(roomCode)];
    }

    static int stripeOf(String roomCode) {
        return Math.floorMod(roomCode.hashCode(), STRIPES);
    }
}
