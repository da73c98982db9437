package com.flagship.swap_coordinator.session;

/**
 * Coordinator-side view of one escrow.
 */
public enum LegState {
    /** Nothing requested on this ledger yet. */
    NONE,
    /** Lock request sent, not yet confirmed. */
    SUBMITTED,
    LOCKED,
    REFUND_REQUESTED,
    REFUNDED,
    WITHDRAWN,
    /** Lock was submitted but its own deadline passed without confirmation. */
    ABANDONED;

    /**
     * True when nothing of ours can still be sitting in this escrow.
     */
    public boolean isSettled() {
        return this == NONE || this == REFUNDED || this == WITHDRAWN || this == ABANDONED;
    }
}
