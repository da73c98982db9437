package com.flagship.swap_coordinator.session;

import lombok.Value;

import java.time.Instant;

/**
 * One entry of a session's step history. Immutable; a status change yields a
 * new step.
 */
@Value
public class SwapStep {
    StepName name;
    StepStatus status;
    Instant timestamp;   // last change, null while waiting

    public static SwapStep waiting(StepName name) {
        return new SwapStep(name, StepStatus.WAITING, null);
    }

    public SwapStep withStatus(StepStatus newStatus, Instant at) {
        return new SwapStep(this.name, newStatus, at);
    }
}
