package com.flagship.swap_coordinator.observer;

/**
 * Receives confirmed events from a {@link ChainObserver}. Implementations
 * must return quickly; the observer thread is shared by every session.
 */
@FunctionalInterface
public interface LedgerEventListener {

    void onLedgerEvent(LedgerEvent event);
}
