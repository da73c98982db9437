package com.flagship.swap_coordinator.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.swap_coordinator.ledger.RawEscrowEvent;
import com.flagship.swap_coordinator.observer.SubscribingChainObserver;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Feeds the subscription observers from the ledger-events topic.
 *
 * Messages are JSON, one of:
 * <pre>
 * {"chainId": "base", "type": "head",   "height": 1234}
 * {"chainId": "base", "type": "escrow", "event": { RawEscrowEvent }}
 * </pre>
 *
 * Escrow messages go through {@link IdempotentEventProcessor} so redelivered
 * messages are dropped before they reach the observer. Head messages are
 * naturally idempotent. Offsets are committed manually after handling.
 */
@Component
@ConditionalOnExpression("${consumer.enabled:true} and '${swap.observer.mode:polling}' == 'subscription'")
@Slf4j
public class LedgerEventConsumer {

    static final String CONSUMER_GROUP = "swap-ledger-observer";
    static final String AGGREGATE_TYPE = "Escrow";

    private final IdempotentEventProcessor eventProcessor;
    private final ObjectMapper objectMapper;
    private final Map<String, SubscribingChainObserver> observersByChain;

    public LedgerEventConsumer(IdempotentEventProcessor eventProcessor, ObjectMapper objectMapper,
                               List<SubscribingChainObserver> observers) {
        this.eventProcessor = eventProcessor;
        this.objectMapper = objectMapper;
        this.observersByChain = observers.stream()
                .collect(Collectors.toMap(SubscribingChainObserver::chainId, Function.identity()));
    }

    @KafkaListener(
        topics = "${kafka.topic.ledger-events:ledger-events}",
        groupId = "${spring.kafka.consumer.group-id:swap-coordinator}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received ledger message: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        try {
            LedgerMessage message = parse(record.value());
            if (message == null) {
                log.warn("Could not parse ledger message at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            SubscribingChainObserver observer = observersByChain.get(message.chainId());
            if (observer == null) {
                log.debug("No observer for chain {}, skipping", message.chainId());
                if ("escrow".equals(message.type()) && message.event() != null && message.event().getEventId() != null) {
                    RawEscrowEvent event = message.event();
                    eventProcessor.skipEvent(eventId(message.chainId(), event), String.valueOf(event.getKind()),
                            AGGREGATE_TYPE, aggregateId(message.chainId(), event), CONSUMER_GROUP,
                            "no observer for chain " + message.chainId());
                }
                ack.acknowledge();
                return;
            }

            switch (message.type()) {
                case "head" -> {
                    if (message.height() != null) {
                        observer.onHead(message.height());
                    }
                }
                case "escrow" -> handleEscrowEvent(message.chainId(), message.event(), observer);
                default -> log.debug("Unknown ledger message type {}, skipping", message.type());
            }
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Error processing ledger message at offset {}: {}", record.offset(), e.getMessage(), e);
            // not acknowledged; redelivered
            throw e;
        }
    }

    private void handleEscrowEvent(String chainId, RawEscrowEvent event, SubscribingChainObserver observer) {
        if (event == null || event.getEventId() == null || event.getKind() == null) {
            log.warn("Escrow message from {} without event id or kind, skipping", chainId);
            return;
        }
        eventProcessor.processEvent(eventId(chainId, event), event.getKind().name(), AGGREGATE_TYPE,
                aggregateId(chainId, event), CONSUMER_GROUP, () -> observer.accept(event));
    }

    private static UUID eventId(String chainId, RawEscrowEvent event) {
        return nameUuid(chainId + ":" + event.getEventId());
    }

    private static UUID aggregateId(String chainId, RawEscrowEvent event) {
        return nameUuid(chainId + ":" + (event.getEscrowId() != null ? event.getEscrowId() : event.getEventId()));
    }

    private LedgerMessage parse(String json) {
        try {
            LedgerMessage message = objectMapper.readValue(json, LedgerMessage.class);
            return message.chainId() != null && message.type() != null ? message : null;
        } catch (Exception e) {
            log.error("Failed to parse ledger message: {}", e.getMessage());
            return null;
        }
    }

    static UUID nameUuid(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    record LedgerMessage(String chainId, String type, Long height, RawEscrowEvent event) { }
}
