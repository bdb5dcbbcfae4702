package com.example.screenrelay.signal;

import com.fasterxml.jackson.databind.JsonNode;

public record SignalEnvelope(SignalKind kind, String fromId, String toId, JsonNode payload) {
}
