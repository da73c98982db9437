package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.ledger.EscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.RawEscrowEvent;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import com.flagship.swap_coordinator.session.ChainRole;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Confirmation, de-duplication, normalization and liveness tracking shared by
 * the polling and subscription observers.
 */
@Slf4j
public abstract class AbstractChainObserver implements ChainObserver {

    private static final int RECENT_EVENT_CAPACITY = 10_000;

    protected final EscrowLedgerClient ledger;
    protected final int confirmationDepth;
    protected final SwapMetrics metrics;
    protected final Clock clock;

    private final LedgerEventListener listener;
    private final Duration staleAfter;
    private final Map<String, Boolean> recentEventIds = new LinkedHashMap<>(256, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > RECENT_EVENT_CAPACITY;
        }
    };
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile boolean running;
    private volatile long lastScannedHeight = -1;
    private volatile Instant lastSuccessAt;
    private volatile Instant startedAt;

    protected AbstractChainObserver(EscrowLedgerClient ledger, int confirmationDepth, LedgerEventListener listener,
                                    SwapMetrics metrics, Clock clock, Duration staleAfter) {
        if (confirmationDepth < 0) {
            throw new IllegalArgumentException("confirmationDepth must be >= 0");
        }
        this.ledger = ledger;
        this.confirmationDepth = confirmationDepth;
        this.listener = listener;
        this.metrics = metrics;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @Override
    public ChainRole role() {
        return ledger.role();
    }

    @Override
    public String chainId() {
        return ledger.chainId();
    }

    @Override
    public void start() {
        startedAt = clock.instant();
        running = true;
        log.info("Started {} observer for {} ledger {} (confirmation depth {})",
                mode(), role(), chainId(), confirmationDepth);
    }

    @Override
    public void stop() {
        running = false;
        log.info("Stopped {} observer for {} ledger {}", mode(), role(), chainId());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public ObserverHealth health() {
        Instant reference = lastSuccessAt != null ? lastSuccessAt : startedAt;
        boolean stale = running && reference != null
                && Duration.between(reference, clock.instant()).compareTo(staleAfter) > 0;
        return new ObserverHealth(role(), chainId(), mode(), running, lastScannedHeight,
                lastSuccessAt, consecutiveFailures.get(), stale);
    }

    protected abstract String mode();

    protected boolean isConfirmed(long eventHeight, long headHeight) {
        return headHeight - eventHeight >= confirmationDepth;
    }

    /**
     * Normalizes and hands one confirmed raw event to the listener. Ids that
     * were already delivered are dropped; an id is only recorded once the
     * listener returned normally, so a failed event is offered again.
     *
     * @return true if the event was delivered, false if it was dropped
     * @throws LedgerEventDeliveryException the listener failed on the event
     */
    protected boolean dispatch(RawEscrowEvent raw) {
        if (raw.getEventId() == null || raw.getKind() == null) {
            log.warn("Ignoring malformed event from {}: {}", chainId(), raw);
            metrics.recordLedgerEvent(role().name(), "unknown", "malformed");
            return false;
        }
        if (alreadyDelivered(raw.getEventId())) {
            metrics.recordLedgerEvent(role().name(), raw.getKind().name(), "duplicate");
            return false;
        }
        LedgerEvent event = normalize(raw);
        try {
            listener.onLedgerEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed on {} event {} from {}: {}",
                    event.getType(), event.getEventId(), chainId(), e.getMessage(), e);
            metrics.recordLedgerEvent(role().name(), event.getType().name(), "listener_error");
            throw new LedgerEventDeliveryException(chainId(), raw.getEventId(), raw.getHeight(), e);
        }
        remember(raw.getEventId());
        return true;
    }

    protected void recordSuccess(long scannedHeight) {
        lastScannedHeight = Math.max(lastScannedHeight, scannedHeight);
        lastSuccessAt = clock.instant();
        consecutiveFailures.set(0);
        metrics.recordObserverPoll(role().name(), "success");
    }

    /**
     * @return the number of consecutive failures including this one
     */
    protected int recordFailure(Exception e) {
        int failures = consecutiveFailures.incrementAndGet();
        metrics.recordObserverPoll(role().name(), "failure");
        log.warn("{} observer for {} failed ({} in a row): {}", mode(), chainId(), failures, e.getMessage());
        return failures;
    }

    protected long lastScannedHeight() {
        return lastScannedHeight;
    }

    private boolean alreadyDelivered(String eventId) {
        synchronized (recentEventIds) {
            return recentEventIds.containsKey(eventId);
        }
    }

    private void remember(String eventId) {
        synchronized (recentEventIds) {
            recentEventIds.put(eventId, Boolean.TRUE);
        }
    }

    private LedgerEvent normalize(RawEscrowEvent raw) {
        LedgerEvent.LedgerEventBuilder builder = LedgerEvent.builder()
                .eventId(raw.getEventId())
                .role(role())
                .chainId(chainId())
                .escrowId(raw.getEscrowId())
                .hashlock(raw.getHashlock())
                .height(raw.getHeight());
        switch (raw.getKind()) {
            case CREATED -> builder.type(LedgerEventType.LOCK_CONFIRMED)
                    .party(raw.getDepositor())
                    .amount(raw.getAmount())
                    .cancellationDeadline(raw.getCancellationDeadline());
            case WITHDRAWN -> builder.type(LedgerEventType.WITHDRAW_CONFIRMED)
                    .secret(raw.getSecret());
            case REFUNDED -> builder.type(LedgerEventType.REFUND_CONFIRMED);
        }
        return builder.build();
    }
}
