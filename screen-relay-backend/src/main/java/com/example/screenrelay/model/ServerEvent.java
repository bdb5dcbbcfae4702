package com.example.screenrelay.model;

public record ServerEvent(String event, Object data) {
}
