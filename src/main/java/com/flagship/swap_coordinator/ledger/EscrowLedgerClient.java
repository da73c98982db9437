package com.flagship.swap_coordinator.ledger;

import com.flagship.swap_coordinator.session.ChainRole;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Contract with one ledger's escrow program, as seen from the coordinator.
 *
 * Submissions are asynchronous: the returned future completes when the
 * gateway accepted the request, not when the escrow is confirmed.
 * Confirmation always arrives later through the chain observer. Failed
 * futures carry {@link TransientLedgerException} or
 * {@link LedgerRequestRejectedException}.
 */
public interface EscrowLedgerClient {

    ChainRole role();

    String chainId();

    /**
     * @return the escrow id assigned by the ledger
     */
    CompletableFuture<String> createLock(LockRequest request);

    CompletableFuture<Void> withdraw(String escrowId, String secret);

    CompletableFuture<Void> refund(String escrowId);

    /**
     * Current tip height. Blocking.
     */
    long headHeight();

    /**
     * Escrow events with {@code fromExclusive < height <= toInclusive}, in
     * height order. Blocking.
     */
    List<RawEscrowEvent> fetchEvents(long fromExclusive, long toInclusive);
}
