package com.flagship.swap_coordinator.ledger;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One escrow log entry as the gateway returns it. {@code eventId} is stable
 * across reads (for EVM ledgers, transaction hash and log index).
 */
@Value
@Builder
@Jacksonized
public class RawEscrowEvent {
    String eventId;
    RawEventKind kind;
    String escrowId;
    String hashlock;
    String depositor;
    String beneficiary;
    BigInteger amount;
    @ToString.Exclude
    String secret;                    // WITHDRAWN only
    Instant cancellationDeadline;     // CREATED only
    long height;
}
