package com.example.screenrelay.support;

import com.example.screenrelay.client.ConnectionStateListener;
import com.example.screenrelay.client.PeerConnectionState;
import com.example.screenrelay.client.PeerSignalingClient;
import com.example.screenrelay.model.CreateRoomRequest;
import com.example.screenrelay.model.JoinRoomRequest;
import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.service.SessionOutbound;
import com.example.screenrelay.signal.SignalKind;
import com.example.screenrelay.signal.SignalRequest;
import com.example.screenrelay.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Real relay services with a queued transport in between, so tests decide when (and in which
 * interleaving) frames reach the peer clients.
 */
public class InMemoryRelay implements SessionOutbound {

    public record Delivery(String sessionId, RelayEvent event, Object payload) {
    }

    public final List<String> timeline = new ArrayList<>();
    public final RelayFixture relay;
    private final Deque<Delivery> queue = new ArrayDeque<>();
    private final Map<String, Endpoint> endpoints = new HashMap<>();

    public InMemoryRelay(String... roomCodes) {
        this.relay = new RelayFixture(this, new SequenceCodes(roomCodes));
    }

    @Override
    public void send(String sessionId, RelayEvent event, Object payload) {
        queue.add(new Delivery(sessionId, event, payload));
    }

    public Endpoint connect(String sessionId) {
        Endpoint endpoint = new Endpoint(sessionId);
        endpoints.put(sessionId, endpoint);
        relay.supervisor.connect(sessionId);
        return endpoint;
    }

    public void disconnect(String sessionId) {
        relay.supervisor.disconnect(sessionId, "transport closed");
        endpoints.remove(sessionId);
    }

    public void deliverAll() {
        deliverWhile(delivery -> true);
    }

    /** Delivers queued frames matching {@code filter} until none are left; others stay queued in order. */
    public void deliverWhile(Predicate<Delivery> filter) {
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            Iterator<Delivery> it = queue.iterator();
            while (it.hasNext()) {
                Delivery delivery = it.next();
                if (filter.test(delivery)) {
                    it.remove();
                    deliver(delivery);
                    progressed = true;
                    break;
                }
            }
        }
    }

    public List<Delivery> pending() {
        return List.copyOf(queue);
    }

    private void deliver(Delivery delivery) {
        Endpoint endpoint = endpoints.get(delivery.sessionId());
        if (endpoint == null) {
            return;
        }
        timeline.add(delivery.sessionId() + " received " + delivery.event().wireName());
        endpoint.client.onServerEvent(delivery.event().wireName(), Jsons.mapper().valueToTree(delivery.payload()));
    }

    public class Endpoint implements ConnectionStateListener {
        public final String id;
        public final PeerSignalingClient client;
        public final Map<String, List<FakeMediaSession>> media = new HashMap<>();
        public final List<String> errors = new ArrayList<>();
        public final List<String> endings = new ArrayList<>();
        public final List<String> exhausted = new ArrayList<>();
        public final Map<String, PeerConnectionState> states = new HashMap<>();

        Endpoint(String id) {
            this.id = id;
            this.client = new PeerSignalingClient(this::dispatch, (peerId, role) -> {
                FakeMediaSession session = new FakeMediaSession(id, peerId, role, timeline);
                media.computeIfAbsent(peerId, k -> new ArrayList<>()).add(session);
                return session;
            }, this);
        }

        /** Latest media session opened towards {@code peerId}. */
        public FakeMediaSession mediaTo(String peerId) {
            List<FakeMediaSession> sessions = media.get(peerId);
            return sessions == null ? null : sessions.get(sessions.size() - 1);
        }

        private void dispatch(String message, Object payload) {
            timeline.add(id + " sent " + message);
            switch (message) {
                case "room:create" -> relay.supervisor.createRoom(id, (CreateRoomRequest) payload);
                case "room:join" -> relay.supervisor.joinRoom(id, (JoinRoomRequest) payload);
                case "room:leave" -> relay.supervisor.leaveRoom(id);
                case "chat:message" -> relay.supervisor.chat(id, (String) payload);
                case "stream:start" -> relay.supervisor.startStream(id);
                case "stream:stop" -> relay.supervisor.stopStream(id);
                case "webrtc:offer" -> relay.supervisor.relaySignal(id, SignalKind.OFFER, (SignalRequest) payload);
                case "webrtc:answer" -> relay.supervisor.relaySignal(id, SignalKind.ANSWER, (SignalRequest) payload);
                case "webrtc:ice-candidate" ->
                        relay.supervisor.relaySignal(id, SignalKind.ICE_CANDIDATE, (SignalRequest) payload);
                default -> throw new IllegalArgumentException("Unknown message " + message);
            }
        }

        @Override
        public void onConnectionStateChanged(String peerId, PeerConnectionState state) {
            states.put(peerId, state);
        }

        @Override
        public void onRestartBudgetExhausted(String peerId) {
            exhausted.add(peerId);
        }

        @Override
        public void onSessionEnded(String reason) {
            endings.add(reason);
        }

        @Override
        public void onError(String message) {
            errors.add(message);
        }
    }
}
