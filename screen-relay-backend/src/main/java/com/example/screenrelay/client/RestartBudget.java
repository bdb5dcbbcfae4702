package com.example.screenrelay.client;

import java.util.HashMap;
import java.util.Map;

public class RestartBudget {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final int maxAttempts;
    private final Map<String, Integer> attempts = new HashMap<>();

    public RestartBudget() {
        this(DEFAULT_MAX_ATTEMPTS);
    }

    public RestartBudget(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public boolean tryAcquire(String peerId) {
        int used = attempts.getOrDefault(peerId, 0);
        if (used >= maxAttempts) {
            return false;
        }
        attempts.put(peerId, used + 1);
        return true;
    }

    public int used(String peerId) {
        return attempts.getOrDefault(peerId, 0);
    }

    public void reset(String peerId) {
        attempts.remove(peerId);
    }
}
