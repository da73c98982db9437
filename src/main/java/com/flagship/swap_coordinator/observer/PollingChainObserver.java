package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.ledger.EscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.RawEscrowEvent;
import com.flagship.swap_coordinator.ledger.RetryBackoff;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observer that reads the ledger on a timer.
 *
 * Each poll reads the head, then scans {@code (cursor, head - depth]} in
 * batches of at most {@code maxBlocksPerPoll} blocks. When it is still
 * behind after a batch the next poll runs immediately; on a read failure it
 * backs off exponentially. On first start the cursor begins
 * {@code replayWindow} blocks below the confirmed tip, so events missed
 * while the process was down are delivered again (the coordinator ignores
 * what it has already applied).
 *
 * A listener failure ends the batch: the cursor stays just below the failed
 * event and the next poll, after the failure backoff, offers it again.
 */
@Slf4j
public class PollingChainObserver extends AbstractChainObserver {

    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final int maxBlocksPerPoll;
    private final long replayWindow;
    private final RetryBackoff backoff;
    private final AtomicReference<ScheduledFuture<?>> nextPoll = new AtomicReference<>();

    private volatile long cursor = -1;
    private volatile boolean behind;

    public PollingChainObserver(EscrowLedgerClient ledger, int confirmationDepth, LedgerEventListener listener,
                                SwapMetrics metrics, Clock clock, Duration staleAfter,
                                TaskScheduler scheduler, Duration pollInterval, int maxBlocksPerPoll,
                                long replayWindow, RetryBackoff backoff) {
        super(ledger, confirmationDepth, listener, metrics, clock, staleAfter);
        if (maxBlocksPerPoll < 1) {
            throw new IllegalArgumentException("maxBlocksPerPoll must be >= 1");
        }
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
        this.maxBlocksPerPoll = maxBlocksPerPoll;
        this.replayWindow = replayWindow;
        this.backoff = backoff;
    }

    @Override
    protected String mode() {
        return "polling";
    }

    @Override
    public void start() {
        super.start();
        scheduleNext(Duration.ZERO);
    }

    @Override
    public void stop() {
        super.stop();
        ScheduledFuture<?> pending = nextPoll.getAndSet(null);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    /**
     * Reads one batch. Public so that tests and operators can drive a poll
     * without the timer.
     *
     * @return number of events handed to the listener
     */
    public int pollOnce() {
        long head = ledger.headHeight();
        long confirmedTip = head - confirmationDepth;
        if (cursor < 0) {
            cursor = Math.max(0, confirmedTip - replayWindow);
            log.info("{} observer for {} starting at height {} (head {})", mode(), chainId(), cursor, head);
        }
        if (confirmedTip <= cursor) {
            behind = false;
            recordSuccess(cursor);
            return 0;
        }

        long to = Math.min(confirmedTip, cursor + maxBlocksPerPoll);
        List<RawEscrowEvent> events = ledger.fetchEvents(cursor, to);

        int delivered = 0;
        for (RawEscrowEvent event : events.stream().sorted(Comparator.comparingLong(RawEscrowEvent::getHeight)).toList()) {
            if (event.getHeight() <= cursor || event.getHeight() > to || !isConfirmed(event.getHeight(), head)) {
                continue;
            }
            try {
                if (dispatch(event)) {
                    delivered++;
                }
            } catch (LedgerEventDeliveryException e) {
                // resume at the failed event's height; what was delivered there is skipped by id
                cursor = event.getHeight() - 1;
                behind = true;
                throw e;
            }
        }

        cursor = to;
        behind = to < confirmedTip;
        recordSuccess(to);
        if (delivered > 0) {
            log.debug("{} observer for {} delivered {} events up to height {}", mode(), chainId(), delivered, to);
        }
        return delivered;
    }

    long cursor() {
        return cursor;
    }

    private void tick() {
        if (!isRunning()) {
            return;
        }
        Duration delay = pollInterval;
        try {
            pollOnce();
            if (behind) {
                delay = Duration.ZERO;
            }
        } catch (RuntimeException e) {
            int failures = recordFailure(e);
            delay = backoff.delayBefore(failures + 1);
        } finally {
            scheduleNext(delay);
        }
    }

    private void scheduleNext(Duration delay) {
        if (!isRunning()) {
            return;
        }
        nextPoll.set(scheduler.schedule(this::tick, scheduler.getClock().instant().plus(delay)));
    }
}
