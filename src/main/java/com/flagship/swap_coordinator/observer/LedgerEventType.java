package com.flagship.swap_coordinator.observer;

public enum LedgerEventType {
    LOCK_CONFIRMED,
    WITHDRAW_CONFIRMED,
    REFUND_CONFIRMED
}
