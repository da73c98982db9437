package com.flagship.swap_coordinator.exception;

import java.util.UUID;

/**
 * Secret requested by someone other than the session's taker.
 */
public class UnauthorizedDisclosureException extends RuntimeException {

    public UnauthorizedDisclosureException(UUID sessionId) {
        super("Requester is not authorized to receive the secret of session " + sessionId);
    }
}
