package com.flagship.swap_coordinator.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Everything an escrow needs to be created: who funds it, who may claim it
 * with the secret, and when the funder may take it back.
 */
@Value
@Builder
public class LockRequest {
    UUID sessionId;
    String hashlock;
    String depositor;
    String beneficiary;
    String token;
    BigInteger amount;
    Instant cancellationDeadline;
    String authorizationSignature;   // maker's signed order, source side only
}
