package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.secret.Hashlocks;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Swap session domain object.
 *
 * Key principles:
 * - Immutable: every change produces a new instance
 * - Status changes go through {@link #transitionTo}, which validates the edge
 *   against {@link SwapStatus} and applies the matching step effects
 * - Parties, chains and amounts never change after creation
 * - The secret can only be attached once both legs are locked, and only if it
 *   opens the hashlock
 */
@Value
@Builder(toBuilder = true)
public class SwapSession {
    UUID sessionId;
    String sourceChain;
    String destinationChain;
    String sourceToken;
    String destinationToken;
    BigInteger sourceAmount;
    BigInteger destinationAmount;
    String maker;
    String taker;
    int slippageToleranceBps;
    String hashlock;
    @ToString.Exclude
    String secret;
    SwapStatus status;
    List<SwapStep> steps;
    EscrowLeg sourceLeg;
    EscrowLeg destinationLeg;
    SwapFees fees;
    boolean degraded;
    String degradedReason;
    String cancellationReason;
    Instant createdAt;
    Instant updatedAt;
    Instant expirationTime;
    Instant estimatedCompletionTime;

    /**
     * Creates a new session in INITIALIZED status with every mainline step
     * waiting and no escrow activity.
     */
    public static SwapSession initialize(UUID sessionId, CreateSessionParams params, String hashlock,
                                         SwapFees fees, Instant now, Duration ttl,
                                         Duration estimatedCompletion) {
        List<SwapStep> steps = new ArrayList<>();
        for (StepName name : StepName.values()) {
            if (name.isMainline()) {
                steps.add(SwapStep.waiting(name));
            }
        }
        return SwapSession.builder()
                .sessionId(sessionId)
                .sourceChain(params.getSourceChain())
                .destinationChain(params.getDestinationChain())
                .sourceToken(params.getSourceToken())
                .destinationToken(params.getDestinationToken())
                .sourceAmount(params.getSourceAmount())
                .destinationAmount(params.getDestinationAmount())
                .maker(params.getMaker())
                .taker(params.getTaker())
                .slippageToleranceBps(params.getSlippageToleranceBps())
                .hashlock(hashlock)
                .status(SwapStatus.INITIALIZED)
                .steps(List.copyOf(steps))
                .sourceLeg(EscrowLeg.none(ChainRole.SOURCE))
                .destinationLeg(EscrowLeg.none(ChainRole.DESTINATION))
                .fees(fees)
                .createdAt(now)
                .updatedAt(now)
                .expirationTime(now.plus(ttl))
                .estimatedCompletionTime(now.plus(estimatedCompletion))
                .build();
    }

    /**
     * Moves the session along exactly one edge of the state graph.
     *
     * @throws InvalidStateException if the edge does not exist
     */
    public SwapSession transitionTo(SwapStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw InvalidStateException.transition(status, next);
        }
        SwapSession moved = toBuilder().status(next).updatedAt(at).build();
        return switch (next) {
            case EXECUTING -> moved.withStep(StepName.INITIALIZE, StepStatus.COMPLETED, at);
            case SOURCE_LOCKING -> moved.withStep(StepName.SOURCE_LOCK, StepStatus.IN_PROGRESS, at);
            case SOURCE_LOCKED -> moved.withStep(StepName.SOURCE_LOCK, StepStatus.COMPLETED, at);
            case DESTINATION_LOCKING -> moved.withStep(StepName.DESTINATION_LOCK, StepStatus.IN_PROGRESS, at);
            case BOTH_LOCKED -> moved.withStep(StepName.DESTINATION_LOCK, StepStatus.COMPLETED, at);
            case REVEALING_SECRET -> moved.stepStatus(StepName.REVEAL_SECRET) == StepStatus.IN_PROGRESS
                    ? moved
                    : moved.withStep(StepName.REVEAL_SECRET, StepStatus.IN_PROGRESS, at);
            case COMPLETED -> moved
                    .withStep(StepName.REVEAL_SECRET, StepStatus.COMPLETED, at)
                    .withStep(StepName.COMPLETE, StepStatus.COMPLETED, at);
            case CANCELLING -> moved.withStep(StepName.REFUND, StepStatus.IN_PROGRESS, at);
            case CANCELLED -> moved
                    .withStep(StepName.REFUND, StepStatus.COMPLETED, at)
                    .failUnfinishedMainline(at);
            case EXPIRED -> moved
                    .withStep(StepName.REFUND, StepStatus.IN_PROGRESS, at)
                    .failUnfinishedMainline(at);
            case INITIALIZED -> moved;
        };
    }

    /**
     * Returns a copy with the named step set to {@code newStatus}. A missing
     * REFUND step is appended. A mainline step can only be completed after
     * every earlier mainline step is completed.
     */
    public SwapSession withStep(StepName name, StepStatus newStatus, Instant at) {
        if (newStatus == StepStatus.COMPLETED && name.isMainline()) {
            for (SwapStep step : steps) {
                if (step.getName() == name) {
                    break;
                }
                if (step.getName().isMainline() && step.getStatus() != StepStatus.COMPLETED) {
                    throw new IllegalStateException(String.format(
                            "Cannot complete step %s while %s is %s",
                            name.wireName(), step.getName().wireName(), step.getStatus().wireName()));
                }
            }
        }
        List<SwapStep> updated = new ArrayList<>(steps.size() + 1);
        boolean found = false;
        for (SwapStep step : steps) {
            if (step.getName() == name) {
                updated.add(step.withStatus(newStatus, at));
                found = true;
            } else {
                updated.add(step);
            }
        }
        if (!found) {
            updated.add(new SwapStep(name, newStatus, at));
        }
        return toBuilder().steps(List.copyOf(updated)).updatedAt(at).build();
    }

    private SwapSession failUnfinishedMainline(Instant at) {
        List<SwapStep> updated = new ArrayList<>(steps.size());
        for (SwapStep step : steps) {
            if (step.getName().isMainline() && !step.getStatus().isSettled()) {
                updated.add(step.withStatus(StepStatus.FAILED, at));
            } else {
                updated.add(step);
            }
        }
        return toBuilder().steps(List.copyOf(updated)).build();
    }

    /**
     * Attaches the disclosed secret.
     *
     * @throws IllegalStateException if both legs are not locked yet, or the
     *         secret does not open this session's hashlock
     */
    public SwapSession withSecret(String candidate, Instant at) {
        if (!status.hasReachedBothLocked()) {
            throw new InvalidStateException(status, String.format(
                    "Cannot attach secret to session %s in %s status", sessionId, status.wireName()));
        }
        if (!Hashlocks.matches(candidate, hashlock)) {
            throw new IllegalStateException("Secret does not match hashlock of session " + sessionId);
        }
        if (secret != null) {
            return this;
        }
        return toBuilder().secret(candidate).updatedAt(at).build();
    }

    public SwapSession withLeg(EscrowLeg leg, Instant at) {
        SwapSessionBuilder builder = toBuilder().updatedAt(at);
        if (leg.getRole() == ChainRole.SOURCE) {
            builder.sourceLeg(leg);
        } else {
            builder.destinationLeg(leg);
        }
        return builder.build();
    }

    public SwapSession markDegraded(String reason, Instant at) {
        return toBuilder().degraded(true).degradedReason(reason).updatedAt(at).build();
    }

    public SwapSession withCancellationReason(String reason) {
        return toBuilder().cancellationReason(reason).build();
    }

    public EscrowLeg leg(ChainRole role) {
        return role == ChainRole.SOURCE ? sourceLeg : destinationLeg;
    }

    public String chainId(ChainRole role) {
        return role == ChainRole.SOURCE ? sourceChain : destinationChain;
    }

    public BigInteger expectedAmount(ChainRole role) {
        return role == ChainRole.SOURCE ? sourceAmount : destinationAmount;
    }

    /**
     * The party expected to fund the escrow on the given side: the maker on
     * the source ledger, the taker on the destination ledger.
     */
    public String expectedDepositor(ChainRole role) {
        return role == ChainRole.SOURCE ? maker : taker;
    }

    public Optional<ChainRole> roleOfEscrow(String escrowId) {
        if (escrowId == null) {
            return Optional.empty();
        }
        if (escrowId.equals(sourceLeg.getEscrowId())) {
            return Optional.of(ChainRole.SOURCE);
        }
        if (escrowId.equals(destinationLeg.getEscrowId())) {
            return Optional.of(ChainRole.DESTINATION);
        }
        return Optional.empty();
    }

    public StepStatus stepStatus(StepName name) {
        return steps.stream()
                .filter(step -> step.getName() == name)
                .map(SwapStep::getStatus)
                .findFirst()
                .orElse(null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasSecret() {
        return secret != null;
    }

    public Duration timeRemaining(Instant now) {
        if (isTerminal() || !now.isBefore(expirationTime)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expirationTime);
    }
}
