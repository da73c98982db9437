package com.flagship.swap_coordinator.coordinator;

import com.flagship.swap_coordinator.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * One mailbox per session, drained by a shared executor.
 *
 * Tasks for the same session run one at a time in submission order; tasks
 * for different sessions run in parallel. A mailbox exists only while it
 * has work. A task that throws is logged and the mailbox moves on. The
 * submitter's correlation id travels with the task.
 */
@Slf4j
public class SessionWorkers {

    private final Executor executor;
    private final ConcurrentHashMap<UUID, Mailbox> mailboxes = new ConcurrentHashMap<>();

    public SessionWorkers(Executor executor) {
        this.executor = executor;
    }

    public void submit(UUID sessionId, Runnable task) {
        Runnable traced = traced(task);
        while (true) {
            Mailbox mailbox = mailboxes.computeIfAbsent(sessionId, Mailbox::new);
            if (mailbox.offer(traced)) {
                return;
            }
            // lost the race against a mailbox that just went idle
        }
    }

    /**
     * Runs {@code task} in the session's mailbox and exposes its result.
     */
    public <T> CompletableFuture<T> call(UUID sessionId, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        submit(sessionId, () -> {
            try {
                result.complete(task.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    public int activeMailboxes() {
        return mailboxes.size();
    }

    private static Runnable traced(Runnable task) {
        String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
        if (correlationId == null) {
            return task;
        }
        return () -> {
            String previous = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, previous);
                } else {
                    MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
                }
            }
        };
    }

    private final class Mailbox implements Runnable {

        private final UUID sessionId;
        private final Queue<Runnable> queue = new ArrayDeque<>();
        private boolean scheduled;
        private boolean closed;

        private Mailbox(UUID sessionId) {
            this.sessionId = sessionId;
        }

        boolean offer(Runnable task) {
            synchronized (this) {
                if (closed) {
                    return false;
                }
                queue.add(task);
                if (scheduled) {
                    return true;
                }
                scheduled = true;
            }
            try {
                executor.execute(this);
            } catch (RejectedExecutionException e) {
                synchronized (this) {
                    queue.clear();
                    scheduled = false;
                    closed = true;
                }
                mailboxes.remove(sessionId, this);
                log.error("Worker pool rejected mailbox of session {}: {}", sessionId, e.getMessage());
                throw e;
            }
            return true;
        }

        @Override
        public void run() {
            String previous = MDC.get(CorrelationContext.SESSION_ID_MDC_KEY);
            MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());
            try {
                while (true) {
                    Runnable next;
                    synchronized (this) {
                        next = queue.poll();
                        if (next == null) {
                            scheduled = false;
                            closed = true;
                            mailboxes.remove(sessionId, this);
                            return;
                        }
                    }
                    try {
                        next.run();
                    } catch (RuntimeException e) {
                        log.error("Task for session {} failed: {}", sessionId, e.getMessage(), e);
                    }
                }
            } finally {
                if (previous != null) {
                    MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, previous);
                } else {
                    MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
                }
            }
        }
    }
}
