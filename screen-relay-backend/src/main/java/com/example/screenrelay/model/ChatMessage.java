package com.example.screenrelay.model;

import java.time.Instant;

public record ChatMessage(String id, String senderId, String senderName, String message, Instant timestamp) {
}
