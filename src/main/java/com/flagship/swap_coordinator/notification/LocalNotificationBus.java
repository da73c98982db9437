package com.flagship.swap_coordinator.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process {@link NotificationBus}.
 *
 * Subscribers run on the publishing thread, which for the coordinator is the
 * session's worker, so per-session order follows publish order. A failing
 * subscriber is logged and skipped.
 */
@Component
@Slf4j
public class LocalNotificationBus implements NotificationBus {

    private final Map<UUID, List<Consumer<SessionNotification>>> subscribers = new ConcurrentHashMap<>();
    private final Map<UUID, Integer> lastProgress = new ConcurrentHashMap<>();

    @Override
    public void publish(SessionNotification notification) {
        UUID sessionId = notification.getSessionId();
        int progress = lastProgress.merge(sessionId, notification.getProgress(), Math::max);
        if (notification.getStatus().isTerminal()) {
            lastProgress.remove(sessionId);
        }
        SessionNotification delivered = progress == notification.getProgress()
                ? notification
                : notification.withProgress(progress);

        List<Consumer<SessionNotification>> targets = subscribers.get(sessionId);
        if (targets == null) {
            return;
        }
        for (Consumer<SessionNotification> subscriber : targets) {
            try {
                subscriber.accept(delivered);
            } catch (RuntimeException e) {
                log.warn("Subscriber of session {} failed on {}: {}",
                        sessionId, delivered.getStatus().wireName(), e.getMessage());
            }
        }
    }

    @Override
    public Subscription subscribe(UUID sessionId, Consumer<SessionNotification> subscriber) {
        subscribers.compute(sessionId, (id, targets) -> {
            List<Consumer<SessionNotification>> list = targets != null ? targets : new CopyOnWriteArrayList<>();
            list.add(subscriber);
            return list;
        });
        return () -> unsubscribe(sessionId, subscriber);
    }

    @Override
    public int subscriberCount(UUID sessionId) {
        List<Consumer<SessionNotification>> targets = subscribers.get(sessionId);
        return targets == null ? 0 : targets.size();
    }

    private void unsubscribe(UUID sessionId, Consumer<SessionNotification> subscriber) {
        subscribers.computeIfPresent(sessionId, (id, targets) -> {
            targets.remove(subscriber);
            return targets.isEmpty() ? null : targets;
        });
    }
}
