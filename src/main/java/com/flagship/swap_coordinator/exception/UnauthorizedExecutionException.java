package com.flagship.swap_coordinator.exception;

import java.util.UUID;

/**
 * Execution requested without an authorization signed by the session's maker.
 */
public class UnauthorizedExecutionException extends RuntimeException {

    public UnauthorizedExecutionException(UUID sessionId, String reason) {
        super("Execution of session " + sessionId + " is not authorized: " + reason);
    }
}
