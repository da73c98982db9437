package com.flagship.swap_coordinator.observability;

import com.flagship.swap_coordinator.observer.ChainObserver;
import com.flagship.swap_coordinator.observer.ObserverHealth;
import com.flagship.swap_coordinator.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicators behind the actuator readiness endpoint.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many session facts are waiting to reach Kafka.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path; losing it degrades, it
     * does not take the service down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                String result = connectionFactory.getConnection().ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency keys fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Down when any chain observer is stopped or has not read its ledger
     * within {@code swap.observer.stale-after}; sessions cannot advance
     * without it.
     */
    @Component("chainObserversHealth")
    public static class ChainObserverHealthIndicator implements HealthIndicator {

        private final ObjectProvider<ChainObserver> observers;

        public ChainObserverHealthIndicator(ObjectProvider<ChainObserver> observers) {
            this.observers = observers;
        }

        @Override
        public Health health() {
            List<ChainObserver> active = observers.orderedStream().toList();
            if (active.isEmpty()) {
                return Health.unknown().withDetail("observers", "disabled").build();
            }
            boolean healthy = true;
            Map<String, Object> details = new LinkedHashMap<>();
            for (ChainObserver observer : active) {
                ObserverHealth status = observer.health();
                healthy &= status.isRunning() && !status.isStale();

                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("chainId", status.getChainId());
                detail.put("mode", status.getMode());
                detail.put("running", status.isRunning());
                detail.put("stale", status.isStale());
                detail.put("lastScannedHeight", status.getLastScannedHeight());
                detail.put("lastSuccessAt", String.valueOf(status.getLastSuccessAt()));
                detail.put("consecutiveFailures", status.getConsecutiveFailures());
                details.put(status.getRole().name().toLowerCase(), detail);
            }
            return (healthy ? Health.up() : Health.down()).withDetails(details).build();
        }
    }
}
