package com.flagship.swap_coordinator.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A session fact waiting in the outbox for delivery to Kafka.
 *
 * Written in the same transaction as the session row it describes, then
 * picked up by {@link OutboxPublisher}. Immutable; publish/retry bookkeeping
 * yields new instances.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "SwapSession"
    UUID aggregateId;          // session id, also the Kafka key
    String eventType;          // "SessionCreated", "SessionStatusChanged"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until delivered
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
