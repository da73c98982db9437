package com.flagship.swap_coordinator.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a swap session.
 *
 * This enum is the single place where the swap state machine lives: the
 * allowed edges, which states are terminal, and the phase/progress pair that
 * subscribers see. Callers never compare statuses ad hoc to decide whether a
 * move is legal; they ask {@link #canTransitionTo(SwapStatus)}.
 *
 * <pre>
 * initialized -> executing -> source_locking -> source_locked
 *             -> destination_locking -> both_locked -> revealing_secret -> completed
 * {initialized .. destination_locking} -> cancelling -> cancelled
 * both_locked -> expired
 * </pre>
 */
public enum SwapStatus {

    INITIALIZED("initialized", "initialization", 0),
    EXECUTING("executing", "execution", 10),
    SOURCE_LOCKING("source_locking", "locking_source", 20),
    SOURCE_LOCKED("source_locked", "source_locked", 40),
    DESTINATION_LOCKING("destination_locking", "locking_destination", 50),
    BOTH_LOCKED("both_locked", "both_locked", 70),
    REVEALING_SECRET("revealing_secret", "revealing", 85),
    COMPLETED("completed", "completed", 100),
    CANCELLING("cancelling", "cancelling", 90),
    CANCELLED("cancelled", "cancelled", 100),

    /**
     * Both legs were locked but the secret was never requested before the
     * session expired. Refunds are requested destination first.
     */
    EXPIRED("expired", "expired", 100);

    private final String wireName;
    private final String phase;
    private final int progress;

    SwapStatus(String wireName, String phase, int progress) {
        this.wireName = wireName;
        this.phase = phase;
        this.progress = progress;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String phase() {
        return phase;
    }

    public int progress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == EXPIRED;
    }

    /**
     * Statuses from which an explicit cancel or a timeout may start the
     * cancellation path.
     */
    public boolean isCancellable() {
        return this == INITIALIZED
                || this == EXECUTING
                || this == SOURCE_LOCKING
                || this == SOURCE_LOCKED
                || this == DESTINATION_LOCKING;
    }

    /**
     * True once both escrows were confirmed; the secret may only be handed out
     * from here on.
     */
    public boolean hasReachedBothLocked() {
        return this == BOTH_LOCKED || this == REVEALING_SECRET || this == COMPLETED;
    }

    /**
     * Checks whether a single edge from this status to {@code target} exists.
     * Self-transitions are not edges.
     */
    public boolean canTransitionTo(SwapStatus target) {
        return successors().contains(target);
    }

    public Set<SwapStatus> successors() {
        return switch (this) {
            case INITIALIZED -> EnumSet.of(EXECUTING, CANCELLING);
            case EXECUTING -> EnumSet.of(SOURCE_LOCKING, CANCELLING);
            case SOURCE_LOCKING -> EnumSet.of(SOURCE_LOCKED, CANCELLING);
            case SOURCE_LOCKED -> EnumSet.of(DESTINATION_LOCKING, CANCELLING);
            case DESTINATION_LOCKING -> EnumSet.of(BOTH_LOCKED, CANCELLING);
            case BOTH_LOCKED -> EnumSet.of(REVEALING_SECRET, EXPIRED);
            case REVEALING_SECRET -> EnumSet.of(COMPLETED);
            case CANCELLING -> EnumSet.of(CANCELLED);
            case COMPLETED, CANCELLED, EXPIRED -> EnumSet.noneOf(SwapStatus.class);
        };
    }

    public static SwapStatus fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown swap status: " + value));
    }
}
