package com.example.screenrelay.controller;

import com.example.screenrelay.service.SessionSupervisor;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
public class SessionLifecycleListener {
    private final SessionSupervisor supervisor;

    public SessionLifecycleListener(SessionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @EventListener
    public void onConnect(SessionConnectEvent event) {
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (sessionId != null) {
            supervisor.connect(sessionId);
        }
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        CloseStatus status = event.getCloseStatus();
        supervisor.disconnect(event.getSessionId(), status == null ? "unknown" : status.toString());
    }
}
