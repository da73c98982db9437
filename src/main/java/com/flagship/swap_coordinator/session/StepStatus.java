package com.flagship.swap_coordinator.session;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    WAITING("waiting"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isSettled() {
        return this == COMPLETED || this == FAILED;
    }
}
