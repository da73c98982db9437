package com.flagship.swap_coordinator.observer;

import lombok.Getter;

/**
 * The listener threw on a confirmed event. The event was not recorded as
 * delivered; the observer must offer it again.
 */
@Getter
public class LedgerEventDeliveryException extends RuntimeException {

    private final String chainId;
    private final String eventId;
    private final long height;

    public LedgerEventDeliveryException(String chainId, String eventId, long height, Throwable cause) {
        super(String.format("Delivery of event %s from %s at height %d failed: %s",
                eventId, chainId, height, cause.getMessage()), cause);
        this.chainId = chainId;
        this.eventId = eventId;
        this.height = height;
    }
}
