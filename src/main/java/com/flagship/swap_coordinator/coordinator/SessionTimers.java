package com.flagship.swap_coordinator.coordinator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * At most one pending deadline per session. Arming replaces the previous
 * timer; a fired timer stays registered until it is re-armed or cancelled,
 * so the callback is expected to re-evaluate the session.
 */
@Slf4j
public class SessionTimers {

    private final TaskScheduler scheduler;
    private final ConcurrentHashMap<UUID, Timer> timers = new ConcurrentHashMap<>();

    public SessionTimers(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void arm(UUID sessionId, Instant at, Runnable action) {
        Timer existing = timers.get(sessionId);
        if (existing != null && existing.at().equals(at) && !existing.future().isDone()) {
            return;
        }
        ScheduledFuture<?> future = scheduler.schedule(action, at);
        Timer previous = timers.put(sessionId, new Timer(at, future));
        if (previous != null) {
            previous.future().cancel(false);
        }
        log.debug("Deadline for session {} set to {}", sessionId, at);
    }

    public void cancel(UUID sessionId) {
        Timer previous = timers.remove(sessionId);
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    public Optional<Instant> deadline(UUID sessionId) {
        return Optional.ofNullable(timers.get(sessionId)).map(Timer::at);
    }

    public int armedCount() {
        return timers.size();
    }

    private record Timer(Instant at, ScheduledFuture<?> future) { }
}
