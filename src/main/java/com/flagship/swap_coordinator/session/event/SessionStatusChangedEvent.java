package com.flagship.swap_coordinator.session.event;

import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable mirror of a status change, same fields as the real-time
 * notification plus the previous status and escrow references.
 */
@Value
public class SessionStatusChangedEvent implements SessionEvent {
    UUID eventId;
    UUID sessionId;
    String previousStatus;
    String status;
    String phase;
    int progress;
    String srcEscrowId;
    String dstEscrowId;
    boolean degraded;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SessionStatusChangedEvent of(SwapStatus previous, SwapSession session) {
        return new SessionStatusChangedEvent(
            UUID.randomUUID(),
            session.getSessionId(),
            previous.wireName(),
            session.getStatus().wireName(),
            session.getStatus().phase(),
            session.getStatus().progress(),
            session.getSourceLeg().getEscrowId(),
            session.getDestinationLeg().getEscrowId(),
            session.isDegraded(),
            session.getUpdatedAt()
        );
    }
}
