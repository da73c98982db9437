package com.flagship.swap_coordinator.notification;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Fan-out of session status changes to interested parties.
 *
 * Delivery is at-least-once per subscriber, in publish order per session,
 * with progress never decreasing. Nothing is promised across sessions.
 */
public interface NotificationBus {

    void publish(SessionNotification notification);

    Subscription subscribe(UUID sessionId, Consumer<SessionNotification> subscriber);

    int subscriberCount(UUID sessionId);

    /**
     * Handle returned by {@link #subscribe}; cancelling is idempotent.
     */
    interface Subscription extends AutoCloseable {

        void cancel();

        @Override
        default void close() {
            cancel();
        }
    }
}
