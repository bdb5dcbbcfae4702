package com.example.screenrelay.signal;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SignalRequest(@NotBlank String to, @NotNull JsonNode data) {
}
