package com.flagship.swap_coordinator.ledger;

/**
 * A ledger read or submission failed in a way that may succeed if retried
 * (I/O error, timeout, 5xx from the gateway).
 */
public class TransientLedgerException extends RuntimeException {

    public TransientLedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientLedgerException(String message) {
        super(message);
    }
}
