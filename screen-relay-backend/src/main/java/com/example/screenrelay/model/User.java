package com.example.screenrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record User(String id, String name, @JsonProperty("isHost") boolean isHost, Instant joinedAt) {
}
