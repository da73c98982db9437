package com.flagship.swap_coordinator.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a handler at most once per (event id, consumer group).
 *
 * Kafka delivers ledger messages at least once: after a crash, a rebalance
 * or a deliberate replay the same message shows up again. The handler runs
 * only if no record exists yet and a record is written only on success. A
 * failure is re-thrown and rolls back, so the unacknowledged message runs
 * the handler again on redelivery.
 *
 * Usage:
 * <pre>
 * processor.processEvent(
 *     eventId, eventType, aggregateType, aggregateId, consumerGroup,
 *     () -> observer.accept(rawEvent)
 * );
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
            recordProcessed(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup));
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Records an event this consumer has no use for, so replays skip it
     * without parsing it again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        recordProcessed(ProcessedEvent.skipped(
                eventId, eventType, aggregateType, aggregateId, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
