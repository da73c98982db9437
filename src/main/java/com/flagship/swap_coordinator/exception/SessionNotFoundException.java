package com.flagship.swap_coordinator.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
