package com.flagship.swap_coordinator.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named milestones recorded on every session.
 *
 * The first five are the mainline and complete strictly in declaration
 * order. {@link #REFUND} is appended only when a session starts unwinding.
 */
public enum StepName {
    INITIALIZE("initialize"),
    SOURCE_LOCK("source_lock"),
    DESTINATION_LOCK("destination_lock"),
    REVEAL_SECRET("reveal_secret"),
    COMPLETE("complete"),
    REFUND("refund");

    private final String wireName;

    StepName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isMainline() {
        return this != REFUND;
    }
}
