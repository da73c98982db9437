package com.flagship.swap_coordinator.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Malformed creation parameters. Raised before any session exists.
 */
@Getter
public class SessionValidationException extends IllegalArgumentException {

    private final Map<String, String> fieldErrors;

    public SessionValidationException(Map<String, String> fieldErrors) {
        super("Invalid session parameters: " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = Map.copyOf(fieldErrors);
    }
}
