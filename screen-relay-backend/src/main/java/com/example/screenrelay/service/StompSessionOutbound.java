package com.example.screenrelay.service;

import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Sends to the {@code /user/queue/events} subscription of a single STOMP session. Sessions
 * are anonymous, so the session id doubles as the user-destination name.
 */
@Component
public class StompSessionOutbound implements SessionOutbound {
    public static final String EVENTS_DESTINATION = "/queue/events";
    private static final Logger log = LoggerFactory.getLogger(StompSessionOutbound.class);

    private final SimpMessagingTemplate messagingTemplate;

    public StompSessionOutbound(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void send(String sessionId, RelayEvent event, Object payload) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sessionId);
        headers.setLeaveMutable(true);
        try {
            messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION,
                    new ServerEvent(event.wireName(), payload), headers.getMessageHeaders());
        } catch (MessagingException e) {
            log.debug("Dropping {} for session {}: {}", event.wireName(), sessionId, e.getMessage());
        }
    }
}
