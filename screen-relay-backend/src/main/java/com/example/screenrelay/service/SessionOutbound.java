package com.example.screenrelay.service;

import com.example.screenrelay.model.RelayEvent;

public interface SessionOutbound {
    void send(String sessionId, RelayEvent event, Object payload);
}
