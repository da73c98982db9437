package com.flagship.swap_coordinator.session;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One side of the swap as seen by the coordinator: the escrow reference
 * returned by the ledger collaborator and how far it got.
 */
@Value
public class EscrowLeg {
    ChainRole role;
    String escrowId;              // opaque, null until the ledger returns it
    LegState state;
    BigInteger amount;            // locked amount as confirmed by the ledger
    Instant cancellationDeadline; // after this the depositor may reclaim
    Instant submittedAt;

    public static EscrowLeg none(ChainRole role) {
        return new EscrowLeg(role, null, LegState.NONE, null, null, null);
    }

    public EscrowLeg submitted(Instant cancellationDeadline, Instant at) {
        return new EscrowLeg(role, escrowId, LegState.SUBMITTED, amount, cancellationDeadline, at);
    }

    public EscrowLeg withEscrowId(String id) {
        return new EscrowLeg(role, id, state, amount, cancellationDeadline, submittedAt);
    }

    public EscrowLeg locked(String id, BigInteger lockedAmount, Instant deadline) {
        return new EscrowLeg(role, id, LegState.LOCKED, lockedAmount,
                deadline != null ? deadline : cancellationDeadline, submittedAt);
    }

    public EscrowLeg withState(LegState newState) {
        return new EscrowLeg(role, escrowId, newState, amount, cancellationDeadline, submittedAt);
    }

    public boolean isIn(LegState candidate) {
        return state == candidate;
    }
}
