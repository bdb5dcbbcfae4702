package com.example.screenrelay.service;

public class InvalidInputException extends RelayException {
    public InvalidInputException(String message) {
        super(message);
    }
}
