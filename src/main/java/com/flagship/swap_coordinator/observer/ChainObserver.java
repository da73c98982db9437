package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.session.ChainRole;

/**
 * Watches one ledger and turns confirmed escrow activity into
 * {@link LedgerEvent}s.
 *
 * Implementations guarantee:
 * - Only events at least {@code confirmationDepth} blocks below the head
 *   are emitted
 * - An event id is emitted at most once per observer instance
 * - Read failures never stop the observer; they are retried with backoff
 *   and show up in {@link #health()}
 */
public interface ChainObserver {

    ChainRole role();

    String chainId();

    void start();

    void stop();

    ObserverHealth health();
}
