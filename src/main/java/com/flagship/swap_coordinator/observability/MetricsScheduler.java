package com.flagship.swap_coordinator.observability;

import com.flagship.swap_coordinator.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, on a timer instead of on
 * every scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SwapMetrics swapMetrics;
    private final SessionStore sessionStore;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshSessionMetrics() {
        try {
            swapMetrics.updateActiveSessions(sessionStore.countActive());
        } catch (Exception e) {
            log.warn("Failed to refresh session metrics: {}", e.getMessage());
        }
    }
}
