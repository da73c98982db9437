package com.flagship.swap_coordinator.ledger;

import lombok.Getter;

/**
 * The ledger gateway refused a request outright. Retrying the same request
 * will not help.
 */
@Getter
public class LedgerRequestRejectedException extends RuntimeException {

    private final int statusCode;

    public LedgerRequestRejectedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
