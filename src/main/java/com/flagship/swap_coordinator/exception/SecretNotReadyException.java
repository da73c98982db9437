package com.flagship.swap_coordinator.exception;

import com.flagship.swap_coordinator.session.SwapStatus;

import java.util.UUID;

/**
 * Secret requested before both escrows were confirmed.
 */
public class SecretNotReadyException extends RuntimeException {

    public SecretNotReadyException(UUID sessionId, SwapStatus status) {
        super(String.format("Secret for session %s is not available in status %s; both sides must be locked first",
                sessionId, status.wireName()));
    }
}
