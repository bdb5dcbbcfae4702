package com.example.screenrelay.signal;

import com.example.screenrelay.service.InvalidInputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Validates signal requests coming from clients and shapes the frames handed to addressees.
 *
 * <p>Wire shape of a relayed frame: {@code {"type": "offer", "from": "...", "to": "...", "data": {...}}}.
 * Descriptions travel as {@code {"type", "sdp"}} and candidates as
 * {@code {"candidate", "sdpMid", "sdpMLineIndex"}}, matching the browser's JSON forms.
 */
public class SignalEnvelopeCodec {
    private final ObjectMapper mapper;

    public SignalEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SignalEnvelope fromClient(SignalKind kind, String fromId, SignalRequest request) {
        if (request == null || isBlank(request.to()) || isAbsent(request.data())) {
            throw new InvalidInputException("Invalid signal");
        }
        String to = request.to().trim();
        if (to.equals(fromId)) {
            throw new InvalidInputException("Invalid signal");
        }
        return new SignalEnvelope(kind, fromId, to, request.data());
    }

    public ObjectNode toFrame(SignalEnvelope envelope) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("type", envelope.kind().wireName());
        frame.put("from", envelope.fromId());
        frame.put("to", envelope.toId());
        frame.set("data", envelope.payload());
        return frame;
    }

    /**
     * Reads a relayed frame. The {@code type} field wins over the event the frame arrived on.
     */
    public SignalEnvelope fromFrame(SignalKind arrivedAs, JsonNode frame) {
        if (frame == null || !frame.isObject()) {
            throw new InvalidInputException("Malformed signal frame");
        }
        SignalKind kind = arrivedAs;
        JsonNode type = frame.get("type");
        if (type != null && type.isTextual()) {
            try {
                kind = SignalKind.fromWireName(type.asText());
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Malformed signal frame");
            }
        }
        String from = text(frame, "from");
        if (from == null || isAbsent(frame.get("data"))) {
            throw new InvalidInputException("Malformed signal frame");
        }
        return new SignalEnvelope(kind, from, text(frame, "to"), frame.get("data"));
    }

    public JsonNode encode(SessionDescription description) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", description.kind().wireName());
        node.put("sdp", description.sdp());
        return node;
    }

    public SessionDescription decodeDescription(JsonNode node) {
        String type = node == null ? null : text(node, "type");
        String sdp = node == null ? null : text(node, "sdp");
        if (type == null || sdp == null) {
            throw new InvalidInputException("Malformed session description");
        }
        try {
            return new SessionDescription(SignalKind.fromWireName(type), sdp);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Malformed session description");
        }
    }

    public JsonNode encode(IceCandidate candidate) {
        ObjectNode node = mapper.createObjectNode();
        node.put("candidate", candidate.candidate());
        if (candidate.sdpMid() != null) {
            node.put("sdpMid", candidate.sdpMid());
        }
        if (candidate.sdpMLineIndex() != null) {
            node.put("sdpMLineIndex", candidate.sdpMLineIndex());
        }
        return node;
    }

    public IceCandidate decodeCandidate(JsonNode node) {
        String candidate = node == null ? null : text(node, "candidate");
        if (candidate == null) {
            throw new InvalidInputException("Malformed ICE candidate");
        }
        JsonNode index = node.get("sdpMLineIndex");
        return new IceCandidate(candidate, text(node, "sdpMid"),
                index != null && index.canConvertToInt() ? index.asInt() : null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
