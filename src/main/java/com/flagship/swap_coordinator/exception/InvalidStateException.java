package com.flagship.swap_coordinator.exception;

import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.Getter;

/**
 * An operation or transition was attempted from a status that forbids it.
 * Never retried.
 */
@Getter
public class InvalidStateException extends IllegalStateException {

    private final SwapStatus currentStatus;

    public InvalidStateException(SwapStatus currentStatus, String message) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public static InvalidStateException transition(SwapStatus from, SwapStatus to) {
        return new InvalidStateException(from, String.format(
                "Cannot transition session from %s to %s. Allowed next statuses: %s",
                from.wireName(), to.wireName(), from.successors()));
    }
}
