package com.flagship.swap_coordinator.session.event;

import com.flagship.swap_coordinator.session.SwapSession;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per session. Carries the public parameters only; the
 * secret never leaves the custody component.
 */
@Value
public class SessionCreatedEvent implements SessionEvent {
    UUID eventId;
    UUID sessionId;
    String sourceChain;
    String destinationChain;
    String sourceToken;
    String destinationToken;
    String sourceAmount;
    String destinationAmount;
    String maker;
    String taker;
    String hashlock;
    Instant expirationTime;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SessionCreatedEvent fromSession(SwapSession session) {
        return new SessionCreatedEvent(
            UUID.randomUUID(),
            session.getSessionId(),
            session.getSourceChain(),
            session.getDestinationChain(),
            session.getSourceToken(),
            session.getDestinationToken(),
            session.getSourceAmount().toString(),
            session.getDestinationAmount().toString(),
            session.getMaker(),
            session.getTaker(),
            session.getHashlock(),
            session.getExpirationTime(),
            session.getCreatedAt()
        );
    }
}
