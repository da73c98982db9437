package com.flagship.swap_coordinator.session;

/**
 * Which side of the swap a ledger, escrow or observer belongs to.
 */
public enum ChainRole {
    SOURCE,
    DESTINATION;

    public ChainRole counterpart() {
        return this == SOURCE ? DESTINATION : SOURCE;
    }
}
