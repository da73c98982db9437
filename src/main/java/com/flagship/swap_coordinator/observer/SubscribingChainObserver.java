package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.ledger.EscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.RawEscrowEvent;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Observer fed by pushed ledger activity (see
 * {@code consumer.LedgerEventConsumer}).
 *
 * Raw events are buffered by height until the head is {@code depth} blocks
 * past them. The first head update after start triggers a backfill of the
 * last {@code replayWindow} blocks through the ledger client, which covers
 * events that were buffered but unconfirmed when the process stopped.
 * Events the listener failed on stay buffered and are retried.
 */
@Slf4j
public class SubscribingChainObserver extends AbstractChainObserver {

    private final long replayWindow;
    private final NavigableMap<Long, List<RawEscrowEvent>> pending = new TreeMap<>();

    private long head = -1;
    private boolean backfilled;

    public SubscribingChainObserver(EscrowLedgerClient ledger, int confirmationDepth, LedgerEventListener listener,
                                    SwapMetrics metrics, Clock clock, Duration staleAfter, long replayWindow) {
        super(ledger, confirmationDepth, listener, metrics, clock, staleAfter);
        this.replayWindow = replayWindow;
    }

    @Override
    protected String mode() {
        return "subscription";
    }

    @Override
    public void stop() {
        super.stop();
        synchronized (pending) {
            backfilled = false;
        }
    }

    /**
     * Buffers one pushed event. Events already below the confirmed tip are
     * released immediately.
     */
    public void accept(RawEscrowEvent event) {
        if (!isRunning()) {
            log.debug("Dropping event {} for {}: observer not running", event.getEventId(), chainId());
            return;
        }
        synchronized (pending) {
            pending.computeIfAbsent(event.getHeight(), h -> new ArrayList<>()).add(event);
        }
        releaseConfirmed();
    }

    /**
     * Advances the known head and releases every event it confirms.
     */
    public void onHead(long height) {
        if (!isRunning()) {
            return;
        }
        boolean needsBackfill;
        synchronized (pending) {
            head = Math.max(head, height);
            needsBackfill = !backfilled;
        }
        if (needsBackfill) {
            backfill(height);
        }
        releaseConfirmed();
        recordSuccess(height);
    }

    int pendingCount() {
        synchronized (pending) {
            return pending.values().stream().mapToInt(List::size).sum();
        }
    }

    private void backfill(long headHeight) {
        long confirmedTip = headHeight - confirmationDepth;
        long from = Math.max(0, confirmedTip - replayWindow);
        if (confirmedTip <= from) {
            markBackfilled();
            return;
        }
        try {
            List<RawEscrowEvent> events = ledger.fetchEvents(from, confirmedTip);
            synchronized (pending) {
                for (RawEscrowEvent event : events) {
                    pending.computeIfAbsent(event.getHeight(), h -> new ArrayList<>()).add(event);
                }
            }
            markBackfilled();
            log.info("Backfilled {} events for {} from heights ({}, {}]", events.size(), chainId(), from, confirmedTip);
        } catch (RuntimeException e) {
            // retried on the next head update
            recordFailure(e);
        }
    }

    private void markBackfilled() {
        synchronized (pending) {
            backfilled = true;
        }
    }

    private void releaseConfirmed() {
        List<RawEscrowEvent> ready = new ArrayList<>();
        synchronized (pending) {
            if (head < 0) {
                return;
            }
            NavigableMap<Long, List<RawEscrowEvent>> confirmed = pending.headMap(head - confirmationDepth, true);
            for (Map.Entry<Long, List<RawEscrowEvent>> entry : confirmed.entrySet()) {
                ready.addAll(entry.getValue());
            }
            confirmed.clear();
        }
        for (int i = 0; i < ready.size(); i++) {
            try {
                dispatch(ready.get(i));
            } catch (LedgerEventDeliveryException e) {
                requeue(ready.subList(i, ready.size()));
                recordFailure(e);
                return;
            }
        }
    }

    /**
     * Puts undelivered events back; the next push or head update releases
     * them again.
     */
    private void requeue(List<RawEscrowEvent> events) {
        synchronized (pending) {
            for (RawEscrowEvent event : events) {
                pending.computeIfAbsent(event.getHeight(), h -> new ArrayList<>()).add(event);
            }
        }
    }
}
