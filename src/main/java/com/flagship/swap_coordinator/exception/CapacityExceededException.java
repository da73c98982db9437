package com.flagship.swap_coordinator.exception;

public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(long active, int limit) {
        super(String.format("Active session limit reached (%d of %d)", active, limit));
    }
}
