package com.example.screenrelay.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record JoinRoomRequest(
        @NotBlank @Pattern(regexp = "^\\s*[A-Za-z0-9]{1,10}\\s*$") String roomCode,
        @NotBlank @Size(max = 50) String userName
) {
}
