package com.flagship.swap_coordinator.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for swap coordination.
 *
 * Metrics exposed:
 * - swap.sessions.created: sessions accepted or rejected at creation
 * - swap.sessions.transitions: status changes by from/to
 * - swap.ledger.submissions: lock/withdraw/refund requests by outcome
 * - swap.ledger.events: observer events by role, type and what the
 *   coordinator did with them
 * - swap.secret.disclosures: disclosure attempts by result
 * - swap.observer.polls: observer read cycles by outcome
 * - swap.sessions.active: gauge refreshed by {@link MetricsScheduler}
 * - swap.api.latency: API handler latency
 */
@Component
public class SwapMetrics {

    private final MeterRegistry registry;
    private final AtomicLong activeSessions = new AtomicLong(0);

    public SwapMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("swap.sessions.active", activeSessions, AtomicLong::get)
                .description("Number of sessions not yet in a terminal status")
                .register(registry);
    }

    public void recordSessionCreated(String sourceChain, String destinationChain, String outcome) {
        registry.counter("swap.sessions.created",
                "source_chain", sanitizeTag(sourceChain),
                "destination_chain", sanitizeTag(destinationChain),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransition(String from, String to) {
        registry.counter("swap.sessions.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordLedgerSubmission(String role, String operation, String outcome) {
        registry.counter("swap.ledger.submissions",
                "role", sanitizeTag(role),
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLedgerEvent(String role, String type, String outcome) {
        registry.counter("swap.ledger.events",
                "role", sanitizeTag(role),
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDisclosure(String result) {
        registry.counter("swap.secret.disclosures", "result", sanitizeTag(result)).increment();
    }

    public void recordObserverPoll(String role, String outcome) {
        registry.counter("swap.observer.polls",
                "role", sanitizeTag(role),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordSessionDegraded(String reason) {
        registry.counter("swap.sessions.degraded", "reason", sanitizeTag(reason)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordApiLatency(String operation, long durationMs) {
        registry.timer("swap.api.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void updateActiveSessions(long count) {
        activeSessions.set(count);
    }

    /**
     * Keeps tag values short and free of characters Prometheus rejects.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
