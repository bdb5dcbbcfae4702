package com.example.screenrelay.service;

import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.User;
import com.example.screenrelay.signal.SignalEnvelope;
import com.example.screenrelay.signal.SignalKind;
import com.example.screenrelay.support.RelayFixture;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RelayRouterTest {

    private SessionOutbound outbound;
    private RelayFixture relay;
    private String code;

    @BeforeEach
    void setUp() {
        outbound = mock(SessionOutbound.class);
        relay = new RelayFixture(outbound);
        for (String id : new String[]{"h", "v1", "v2"}) {
            relay.directory.register(id);
        }
        code = relay.registry.createRoom("h", "Alice", null, null).code();
        relay.directory.bind("h", new User("h", "Alice", true, relay.clock.instant()), code);
        for (String id : new String[]{"v1", "v2"}) {
            User viewer = new User(id, id, false, relay.clock.instant());
            relay.registry.joinRoom(code, viewer);
            relay.directory.bind(id, viewer, code);
        }
    }

    private static SignalEnvelope candidate(String from, String to, String value) {
        return new SignalEnvelope(SignalKind.ICE_CANDIDATE, from, to, TextNode.valueOf(value));
    }

    @Test
    void routesToAddresseeOnly() {
        assertThat(relay.router.route(candidate("h", "v1", "c1"))).isTrue();

        verify(outbound).send(eq("v1"), eq(RelayEvent.WEBRTC_ICE_CANDIDATE), any());
        verify(outbound, never()).send(eq("v2"), any(), any());
        verify(outbound, never()).send(eq("h"), any(), any());
    }

    @Test
    void dropsEnvelopeForDisconnectedOrForeignRecipient() {
        relay.directory.unregister("v2");
        relay.directory.register("outsider");

        assertThat(relay.router.route(candidate("h", "v2", "c1"))).isFalse();
        assertThat(relay.router.route(candidate("h", "outsider", "c1"))).isFalse();
        assertThat(relay.router.route(candidate("outsider", "h", "c1"))).isFalse();

        verifyNoInteractions(outbound);
    }

    @Test
    void preservesPerSenderOrder() {
        for (int i = 0; i < 5; i++) {
            relay.router.route(candidate("h", "v1", "c" + i));
        }

        InOrder order = inOrder(outbound);
        for (int i = 0; i < 5; i++) {
            String expected = "c" + i;
            order.verify(outbound).send(eq("v1"), eq(RelayEvent.WEBRTC_ICE_CANDIDATE),
                    argThat(frame ->
                            frame.toString().contains("\"" + expected + "\"")));
        }
    }

    @Test
    void broadcastSkipsExcludedAndDisconnectedMembers() {
        relay.directory.unregister("v2");

        int delivered = relay.router.broadcast(code, RelayEvent.CHAT_MESSAGE, "hi", "v1");

        assertThat(delivered).isEqualTo(1);
        verify(outbound).send("h", RelayEvent.CHAT_MESSAGE, "hi");
        verify(outbound, never()).send(eq("v1"), any(), any());
        verify(outbound, never()).send(eq("v2"), any(), any());
    }

    @Test
    void broadcastToUnknownRoomDeliversNothing() {
        assertThat(relay.router.broadcast("NOPE42", RelayEvent.CHAT_MESSAGE, "hi", null)).isZero();
        verify(outbound, never()).send(anyString(), any(), any());
    }
}
