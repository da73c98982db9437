package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.session.ChainRole;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A confirmed escrow event, normalized for the coordinator.
 *
 * - LOCK_CONFIRMED carries party, amount and cancellationDeadline
 * - WITHDRAW_CONFIRMED carries the secret used to open the escrow
 * - REFUND_CONFIRMED carries only the escrow reference
 */
@Value
@Builder(toBuilder = true)
public class LedgerEvent {
    String eventId;
    LedgerEventType type;
    ChainRole role;
    String chainId;
    String escrowId;
    String hashlock;
    String party;
    BigInteger amount;
    Instant cancellationDeadline;
    @ToString.Exclude
    String secret;
    long height;
}
