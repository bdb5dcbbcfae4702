package com.example.screenrelay.service;

import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.RoomSnapshot;
import com.example.screenrelay.signal.SignalEnvelope;
import com.example.screenrelay.signal.SignalEnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Point-to-point delivery of signal envelopes and fan-out of room events. A recipient that is
 * gone is not an error: the frame is dropped.
 */
@Service
public class RelayRouter {
    private static final Logger log = LoggerFactory.getLogger(RelayRouter.class);

    private final SessionOutbound outbound;
    private final SessionDirectory directory;
    private final RoomRegistry registry;
    private final SignalEnvelopeCodec codec;

    public RelayRouter(SessionOutbound outbound, SessionDirectory directory, RoomRegistry registry,
                       SignalEnvelopeCodec codec) {
        this.outbound = outbound;
        this.directory = directory;
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Delivers the envelope to {@code toId} when that session is connected and sits in the
     * sender's room.
     *
     * @return whether the envelope was handed to the transport
     */
    public boolean route(SignalEnvelope envelope) {
        Optional<String> senderRoom = directory.roomOf(envelope.fromId());
        Optional<String> recipientRoom = directory.roomOf(envelope.toId());
        if (senderRoom.isEmpty() || !senderRoom.equals(recipientRoom)) {
            log.debug("[WebRTC] Dropping {} from {} to {}: recipient not reachable",
                    envelope.kind().wireName(), envelope.fromId(), envelope.toId());
            return false;
        }
        log.debug("[WebRTC] Relaying {} from {} to {}", envelope.kind().wireName(), envelope.fromId(), envelope.toId());
        outbound.send(envelope.toId(), envelope.kind().event(), codec.toFrame(envelope));
        return true;
    }

    public int broadcast(String roomCode, RelayEvent event, Object payload, String excludeId) {
        return registry.find(roomCode)
                .map(room -> broadcast(room, event, payload, excludeId))
                .orElse(0);
    }

    /**
     * Sends to every connected member of {@code room} except {@code excludeId}.
     *
     * @return number of sessions the event was handed to
     */
    public int broadcast(RoomSnapshot room, RelayEvent event, Object payload, String excludeId) {
        int delivered = 0;
        for (String memberId : room.memberIds()) {
            if (Objects.equals(memberId, excludeId) || !directory.isConnected(memberId)) {
                continue;
            }
            outbound.send(memberId, event, payload);
            delivered++;
        }
        return delivered;
    }

    public void send(String sessionId, RelayEvent event, Object payload) {
        if (directory.isConnected(sessionId)) {
            outbound.send(sessionId, event, payload);
        }
    }

    public void sendError(String sessionId, String message) {
        send(sessionId, RelayEvent.ERROR, message);
    }
}
