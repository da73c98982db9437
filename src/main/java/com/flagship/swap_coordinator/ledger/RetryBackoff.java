package com.flagship.swap_coordinator.ledger;

import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff for ledger calls.
 *
 * Attempt 1 is the first try and has no delay; attempt n waits
 * {@code initial * factor^(n-2)}, capped at {@code max}.
 */
@Value
public class RetryBackoff {
    Duration initialDelay;
    double factor;
    Duration maxDelay;
    int maxAttempts;

    public RetryBackoff(Duration initialDelay, double factor, Duration maxDelay, int maxAttempts) {
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Backoff delays must satisfy 0 <= initial <= max");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        this.initialDelay = initialDelay;
        this.factor = factor;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 4);
    }

    /**
     * Delay to wait before the given attempt (1-based).
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(factor, attempt - 2);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis((long) millis);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
