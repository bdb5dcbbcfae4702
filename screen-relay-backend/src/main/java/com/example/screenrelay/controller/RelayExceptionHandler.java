package com.example.screenrelay.controller;

import com.example.screenrelay.service.InvalidInputException;
import com.example.screenrelay.service.RoomNotFoundException;
import com.example.screenrelay.service.RoomRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class RelayExceptionHandler {
    private final RoomRegistry registry;

    public RelayExceptionHandler(RoomRegistry registry) {
        this.registry = registry;
    }

    @ExceptionHandler(RoomNotFoundException.class)
    public ResponseEntity<?> roomNotFound(RoomNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", e.getMessage(), "availableRooms", registry.codes()));
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<?> invalidInput(InvalidInputException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
