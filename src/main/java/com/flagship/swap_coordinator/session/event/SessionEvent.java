package com.flagship.swap_coordinator.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every session fact written to the outbox.
 * {@code eventId} lets downstream consumers de-duplicate redeliveries.
 */
public interface SessionEvent {

    UUID getEventId();

    UUID getSessionId();

    Instant getOccurredAt();

    String getEventType();
}
