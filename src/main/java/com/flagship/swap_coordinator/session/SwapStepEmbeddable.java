package com.flagship.swap_coordinator.session;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of swap_session_steps. Position is kept by the owning collection.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SwapStepEmbeddable {

    @Enumerated(EnumType.STRING)
    @Column(name = "name", nullable = false, length = 32)
    private StepName name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private StepStatus status;

    @Column(name = "changed_at")
    private Instant changedAt;

    static SwapStepEmbeddable fromDomain(SwapStep step) {
        return new SwapStepEmbeddable(step.getName(), step.getStatus(), step.getTimestamp());
    }

    SwapStep toDomain() {
        return new SwapStep(name, status, changedAt);
    }
}
