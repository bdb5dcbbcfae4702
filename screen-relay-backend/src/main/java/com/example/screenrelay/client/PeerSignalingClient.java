package com.example.screenrelay.client;

import com.example.screenrelay.model.CreateRoomRequest;
import com.example.screenrelay.model.JoinRoomRequest;
import com.example.screenrelay.model.JoinedRoom;
import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.RoomSnapshot;
import com.example.screenrelay.model.RoomUpdate;
import com.example.screenrelay.model.User;
import com.example.screenrelay.negotiation.NegotiationAction;
import com.example.screenrelay.negotiation.NegotiationEngine;
import com.example.screenrelay.negotiation.NegotiationPhase;
import com.example.screenrelay.negotiation.NegotiationState;
import com.example.screenrelay.negotiation.PeerRole;
import com.example.screenrelay.negotiation.Transition;
import com.example.screenrelay.service.InvalidInputException;
import com.example.screenrelay.signal.IceCandidate;
import com.example.screenrelay.signal.SessionDescription;
import com.example.screenrelay.signal.SignalEnvelope;
import com.example.screenrelay.signal.SignalEnvelopeCodec;
import com.example.screenrelay.signal.SignalKind;
import com.example.screenrelay.signal.SignalRequest;
import com.example.screenrelay.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Endpoint-side driver of the negotiation protocol. Keeps one {@link PeerLink} per remote
 * peer, feeds relay events and media callbacks through the {@link NegotiationEngine}, and
 * executes the resulting actions against the media session and the relay transport.
 *
 * <p>A host is impolite towards every viewer and offers to each one while streaming; a viewer
 * is polite and answers. Links are created on demand and closed synchronously when the peer
 * leaves, the stream stops or the room closes. Signals from a peer whose link was closed for
 * good are dropped.
 *
 * <p>All entry points are synchronized, so transitions for one pair apply in arrival order.
 */
public class PeerSignalingClient {
    private static final Logger log = LoggerFactory.getLogger(PeerSignalingClient.class);

    private final SignalTransport transport;
    private final MediaSessionFactory mediaFactory;
    private final ConnectionStateListener listener;
    private final ObjectMapper mapper;
    private final SignalEnvelopeCodec codec;
    private final RestartBudget restartBudget;
    private final NegotiationEngine engine = new NegotiationEngine();

    private final Map<String, PeerLink> links = new LinkedHashMap<>();
    private final Map<String, User> viewers = new LinkedHashMap<>();
    private final Set<String> departed = new HashSet<>();
    private String localId;
    private String roomCode;
    private String hostId;
    private boolean host;
    private boolean streaming;

    public PeerSignalingClient(SignalTransport transport,
                               MediaSessionFactory mediaFactory,
                               ConnectionStateListener listener) {
        this(transport, mediaFactory, listener, Jsons.mapper(), new RestartBudget());
    }

    public PeerSignalingClient(SignalTransport transport,
                               MediaSessionFactory mediaFactory,
                               ConnectionStateListener listener,
                               ObjectMapper mapper,
                               RestartBudget restartBudget) {
        this.transport = transport;
        this.mediaFactory = mediaFactory;
        this.listener = listener;
        this.mapper = mapper;
        this.codec = new SignalEnvelopeCodec(mapper);
        this.restartBudget = restartBudget;
    }

    public synchronized void createRoom(String hostName, String requestedCode, Integer maxViewers) {
        transport.send("room:create", new CreateRoomRequest(hostName, requestedCode, maxViewers));
    }

    public synchronized void joinRoom(String code, String userName) {
        transport.send("room:join", new JoinRoomRequest(code, userName));
    }

    public synchronized void sendChat(String message) {
        transport.send("chat:message", message);
    }

    /**
     * Dispatches one frame received on the relay's event queue.
     */
    public synchronized void onServerEvent(String event, JsonNode data) {
        RelayEvent relayEvent;
        try {
            relayEvent = RelayEvent.fromWireName(event);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown relay event {}", event);
            return;
        }
        switch (relayEvent) {
            case ROOM_CREATED -> onRoomCreated(mapper.convertValue(data, RoomSnapshot.class));
            case ROOM_JOINED -> onRoomJoined(mapper.convertValue(data, JoinedRoom.class));
            case ROOM_UPDATED -> onRoomUpdated(mapper.convertValue(data, RoomUpdate.class));
            case USER_JOINED -> onUserJoined(mapper.convertValue(data, User.class));
            case USER_LEFT -> onUserLeft(data.asText());
            case STREAM_STARTED -> onStreamStarted();
            case STREAM_STOPPED -> onStreamStopped();
            case ROOM_CLOSED, HOST_DISCONNECTED -> onRoomClosed(data == null ? relayEvent.wireName() : data.asText());
            case WEBRTC_OFFER -> onSignalFrame(SignalKind.OFFER, data);
            case WEBRTC_ANSWER -> onSignalFrame(SignalKind.ANSWER, data);
            case WEBRTC_ICE_CANDIDATE -> onSignalFrame(SignalKind.ICE_CANDIDATE, data);
            case ERROR -> listener.onError(data == null ? "error" : data.asText());
            default -> log.debug("No negotiation work for {}", event);
        }
    }

    public synchronized void onRoomCreated(RoomSnapshot room) {
        localId = room.hostId();
        hostId = room.hostId();
        roomCode = room.code();
        host = true;
        streaming = false;
        viewers.clear();
        departed.clear();
        for (User viewer : room.viewers()) {
            viewers.put(viewer.id(), viewer);
        }
    }

    public synchronized void onRoomJoined(JoinedRoom room) {
        localId = room.you().id();
        hostId = room.hostId();
        roomCode = room.code();
        host = false;
        streaming = room.isStreaming();
        departed.clear();
    }

    public synchronized void onRoomUpdated(RoomUpdate update) {
        if (!host) {
            return;
        }
        viewers.clear();
        for (User viewer : update.viewers()) {
            if (!viewer.id().equals(localId)) {
                viewers.put(viewer.id(), viewer);
            }
        }
    }

    public synchronized void onUserJoined(User user) {
        if (user.id().equals(localId)) {
            return;
        }
        departed.remove(user.id());
        if (host) {
            viewers.put(user.id(), user);
            if (streaming) {
                offerTo(user.id());
            }
        }
    }

    public synchronized void onUserLeft(String userId) {
        viewers.remove(userId);
        departed.add(userId);
        closeLink(userId);
    }

    /**
     * Host only: announces the stream and offers to every known viewer.
     */
    public synchronized void startStreaming() {
        if (!host || roomCode == null) {
            throw new IllegalStateException("Only a host in a room can start streaming");
        }
        streaming = true;
        transport.send("stream:start", Map.of());
        for (String viewerId : new ArrayList<>(viewers.keySet())) {
            offerTo(viewerId);
        }
    }

    public synchronized void stopStreaming() {
        if (!host || roomCode == null) {
            return;
        }
        streaming = false;
        transport.send("stream:stop", Map.of());
        closeAllLinks();
    }

    public synchronized void onStreamStarted() {
        streaming = true;
    }

    public synchronized void onStreamStopped() {
        streaming = false;
        closeAllLinks();
    }

    public synchronized void onRoomClosed(String reason) {
        closeAllLinks();
        roomCode = null;
        streaming = false;
        viewers.clear();
        listener.onSessionEnded(reason);
    }

    public synchronized void leave() {
        if (roomCode == null) {
            return;
        }
        transport.send("room:leave", Map.of());
        closeAllLinks();
        roomCode = null;
        streaming = false;
        viewers.clear();
        departed.clear();
    }

    public synchronized void onSignal(SignalEnvelope envelope) {
        String from = envelope.fromId();
        if (roomCode == null || departed.contains(from)) {
            log.debug("[WebRTC {}] Dropping {} from departed or unknown peer", from, envelope.kind().wireName());
            return;
        }
        try {
            if (envelope.kind() == SignalKind.ICE_CANDIDATE) {
                IceCandidate candidate = codec.decodeCandidate(envelope.payload());
                PeerLink link = linkFor(from);
                apply(link, engine.onRemoteCandidate(link.state(), candidate));
                return;
            }
            SessionDescription description = codec.decodeDescription(envelope.payload());
            if (!description.isOffer() && !links.containsKey(from)) {
                log.debug("[WebRTC {}] Dropping answer without a negotiation", from);
                return;
            }
            PeerLink link = linkFor(from);
            apply(link, engine.onRemoteDescription(link.state(), description));
        } catch (InvalidInputException e) {
            log.warn("[WebRTC {}] Ignoring malformed {}: {}", from, envelope.kind().wireName(), e.getMessage());
        }
    }

    private void onSignalFrame(SignalKind kind, JsonNode frame) {
        try {
            onSignal(codec.fromFrame(kind, frame));
        } catch (InvalidInputException e) {
            log.warn("Ignoring malformed {} frame: {}", kind.wireName(), e.getMessage());
        }
    }

    /** Called by the media stack for every locally gathered candidate. */
    public synchronized void onLocalCandidate(String peerId, IceCandidate candidate) {
        PeerLink link = links.get(peerId);
        if (link == null || link.state().isClosed()) {
            return;
        }
        sendSignal(SignalKind.ICE_CANDIDATE, peerId, codec.encode(candidate));
    }

    /** Called by the media stack when the connection to {@code peerId} changes state. */
    public synchronized void onConnectionStateChange(String peerId, PeerConnectionState state) {
        PeerLink link = links.get(peerId);
        if (link == null) {
            return;
        }
        listener.onConnectionStateChanged(peerId, state);
        if (state == PeerConnectionState.CONNECTED) {
            restartBudget.reset(peerId);
        } else if (state == PeerConnectionState.FAILED) {
            apply(link, engine.onConnectivityFailure(link.state()));
        }
    }

    private void offerTo(String peerId) {
        PeerLink link = linkFor(peerId);
        NegotiationPhase phase = link.state().phase();
        if (phase == NegotiationPhase.IDLE) {
            apply(link, engine.start(link.state()));
        } else if (phase == NegotiationPhase.STABLE) {
            apply(link, engine.renegotiate(link.state(), false));
        }
    }

    private PeerLink linkFor(String peerId) {
        PeerLink link = links.get(peerId);
        if (link == null) {
            PeerRole role = PeerRole.forLocalSide(host);
            link = new PeerLink(peerId, mediaFactory.open(peerId, role), NegotiationState.initial(peerId, role));
            links.put(peerId, link);
            log.debug("[WebRTC {}] Opened {} link", peerId, role);
        }
        return link;
    }

    private void closeLink(String peerId) {
        PeerLink link = links.remove(peerId);
        restartBudget.reset(peerId);
        if (link == null) {
            return;
        }
        apply(link, engine.close(link.state()));
        listener.onConnectionStateChanged(peerId, PeerConnectionState.CLOSED);
    }

    private void closeAllLinks() {
        for (String peerId : new ArrayList<>(links.keySet())) {
            closeLink(peerId);
        }
    }

    private void apply(PeerLink link, Transition transition) {
        link.state(transition.state());
        try {
            for (NegotiationAction action : transition.actions()) {
                execute(link, action);
            }
        } catch (RuntimeException e) {
            log.error("[WebRTC {}] Negotiation step failed", link.peerId(), e);
            listener.onError("Negotiation with " + link.peerId() + " failed: " + e.getMessage());
        }
    }

    private void execute(PeerLink link, NegotiationAction action) {
        MediaSession media = link.media();
        switch (action.type()) {
            case CREATE_OFFER -> {
                SessionDescription offer = media.createOffer(action.iceRestart());
                sendSignal(SignalKind.OFFER, link.peerId(), codec.encode(offer));
            }
            case ROLLBACK_LOCAL -> media.rollbackLocalDescription();
            case APPLY_REMOTE_DESCRIPTION -> media.setRemoteDescription(action.description());
            case APPLY_CANDIDATE -> {
                try {
                    media.addIceCandidate(action.candidate());
                } catch (RuntimeException e) {
                    log.warn("[WebRTC {}] Error adding ICE candidate: {}", link.peerId(), e.getMessage());
                }
            }
            case CREATE_ANSWER -> {
                SessionDescription answer = media.createAnswer();
                sendSignal(SignalKind.ANSWER, link.peerId(), codec.encode(answer));
                link.state(engine.onLocalAnswerApplied(link.state()).state());
            }
            case REQUEST_RESTART -> restart(link);
            case RELEASE -> media.close();
        }
    }

    private void restart(PeerLink link) {
        String peerId = link.peerId();
        if (!restartBudget.tryAcquire(peerId)) {
            log.warn("[WebRTC {}] Connection failed after maximum retry attempts", peerId);
            listener.onRestartBudgetExhausted(peerId);
            closeLink(peerId);
            return;
        }
        log.info("[WebRTC {}] Attempting reconnection ({})", peerId, restartBudget.used(peerId));
        Transition restart = engine.renegotiate(link.state(), true);
        if (!restart.actions().isEmpty()) {
            apply(link, restart);
        } else if (host && link.state().phase() != NegotiationPhase.CLOSED) {
            // failed before the pair ever settled: start over on a fresh session, keeping the budget
            links.remove(peerId);
            apply(link, engine.close(link.state()));
            PeerLink fresh = linkFor(peerId);
            apply(fresh, engine.start(fresh.state()));
        }
    }

    private void sendSignal(SignalKind kind, String to, JsonNode data) {
        transport.send(kind.event().wireName(), new SignalRequest(to, data));
    }

    public synchronized String localId() {
        return localId;
    }

    public synchronized String roomCode() {
        return roomCode;
    }

    public synchronized String hostId() {
        return hostId;
    }

    public synchronized boolean isHost() {
        return host;
    }

    public synchronized boolean isStreaming() {
        return streaming;
    }

    public synchronized Set<String> activePeers() {
        return new LinkedHashSet<>(links.keySet());
    }

    public synchronized Optional<NegotiationState> negotiationState(String peerId) {
        PeerLink link = links.get(peerId);
        return link == null ? Optional.empty() : Optional.of(link.state());
    }
}
