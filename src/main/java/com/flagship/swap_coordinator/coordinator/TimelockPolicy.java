package com.flagship.swap_coordinator.coordinator;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cancellation deadlines for the two escrows.
 *
 * The destination escrow always becomes refundable at least
 * {@code cancellationMargin} before the source escrow, so the maker's
 * withdrawal (which reveals the secret) can never land after the taker has
 * already been able to reclaim the destination side.
 */
@Value
public class TimelockPolicy {
    Duration sourceLockWindow;
    Duration destinationLockWindow;
    Duration cancellationMargin;

    public static TimelockPolicy defaults() {
        return new TimelockPolicy(Duration.ofMinutes(15), Duration.ofMinutes(14), Duration.ofMinutes(1));
    }

    public Instant sourceDeadline(Instant now) {
        return now.plus(sourceLockWindow);
    }

    public Instant destinationDeadline(Instant now, Instant sourceDeadline) {
        Instant byWindow = now.plus(destinationLockWindow);
        Instant bySource = sourceDeadline.minus(cancellationMargin);
        return byWindow.isBefore(bySource) ? byWindow : bySource;
    }

    /**
     * The latest moment the coordinator may still act on an escrow that
     * becomes refundable at {@code deadline}.
     */
    public Instant actBefore(Instant deadline) {
        return deadline.minus(cancellationMargin);
    }
}
