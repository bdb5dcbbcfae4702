package com.example.screenrelay.controller;

import com.example.screenrelay.model.CreateRoomRequest;
import com.example.screenrelay.model.JoinRoomRequest;
import com.example.screenrelay.service.SessionSupervisor;
import com.example.screenrelay.signal.SignalKind;
import com.example.screenrelay.signal.SignalRequest;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Inbound side of the signaling protocol. Clients send to {@code /app/<message>}; every
 * message is handed to the supervisor together with the sending session id.
 */
@Controller
public class SignalingController {
    private final SessionSupervisor supervisor;

    public SignalingController(SessionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @MessageMapping("room:create")
    public void createRoom(@Payload CreateRoomRequest request, SimpMessageHeaderAccessor headers) {
        supervisor.createRoom(headers.getSessionId(), request);
    }

    @MessageMapping("room:join")
    public void joinRoom(@Payload JoinRoomRequest request, SimpMessageHeaderAccessor headers) {
        supervisor.joinRoom(headers.getSessionId(), request);
    }

    @MessageMapping("room:leave")
    public void leaveRoom(SimpMessageHeaderAccessor headers) {
        supervisor.leaveRoom(headers.getSessionId());
    }

    @MessageMapping("chat:message")
    public void chat(@Payload String message, SimpMessageHeaderAccessor headers) {
        supervisor.chat(headers.getSessionId(), message);
    }

    @MessageMapping("webrtc:offer")
    public void offer(@Payload SignalRequest request, SimpMessageHeaderAccessor headers) {
        supervisor.relaySignal(headers.getSessionId(), SignalKind.OFFER, request);
    }

    @MessageMapping("webrtc:answer")
    public void answer(@Payload SignalRequest request, SimpMessageHeaderAccessor headers) {
        supervisor.relaySignal(headers.getSessionId(), SignalKind.ANSWER, request);
    }

    @MessageMapping("webrtc:ice-candidate")
    public void iceCandidate(@Payload SignalRequest request, SimpMessageHeaderAccessor headers) {
        supervisor.relaySignal(headers.getSessionId(), SignalKind.ICE_CANDIDATE, request);
    }

    @MessageMapping("stream:start")
    public void startStream(SimpMessageHeaderAccessor headers) {
        supervisor.startStream(headers.getSessionId());
    }

    @MessageMapping("stream:stop")
    public void stopStream(SimpMessageHeaderAccessor headers) {
        supervisor.stopStream(headers.getSessionId());
    }

    @MessageExceptionHandler(MessageConversionException.class)
    public void unreadablePayload(MessageConversionException e, SimpMessageHeaderAccessor headers) {
        supervisor.rejectUnreadable(headers.getSessionId(), headers.getDestination(), e);
    }
}
