package com.flagship.swap_coordinator.ledger;

/**
 * Escrow activity as reported by a ledger gateway, before confirmation.
 */
public enum RawEventKind {
    CREATED,
    WITHDRAWN,
    REFUNDED
}
