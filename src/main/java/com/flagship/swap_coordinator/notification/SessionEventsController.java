package com.flagship.swap_coordinator.notification;

import com.flagship.swap_coordinator.session.SessionStore;
import com.flagship.swap_coordinator.session.SwapSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Server-sent events stream of one session's status notifications.
 *
 * The first event is a snapshot of the current status; the stream completes
 * after a terminal status has been sent. The subscription is taken before
 * the snapshot is read, so a change landing in between is still streamed.
 */
@RestController
@RequestMapping("/api/sessions")
@Slf4j
public class SessionEventsController {

    static final String EVENT_NAME = "status";

    private final SessionStore sessionStore;
    private final NotificationBus notificationBus;
    private final Clock clock;
    private final Duration streamTimeout;

    public SessionEventsController(SessionStore sessionStore,
                                   NotificationBus notificationBus,
                                   Clock clock,
                                   @Value("${swap.notifications.sse-timeout:30m}") Duration streamTimeout) {
        this.sessionStore = sessionStore;
        this.notificationBus = notificationBus;
        this.clock = clock;
        this.streamTimeout = streamTimeout;
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable("id") UUID id) {
        SseEmitter emitter = createEmitter();
        SessionStream stream = new SessionStream(emitter);

        NotificationBus.Subscription subscription = notificationBus.subscribe(id, stream::deliver);
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());

        SwapSession session;
        try {
            session = sessionStore.get(id);
        } catch (RuntimeException e) {
            subscription.cancel();
            throw e;
        }
        if (!stream.start(SessionNotification.of(session, clock.instant()))) {
            subscription.cancel();
            return emitter;
        }
        log.debug("Streaming notifications of session {} ({} subscribers)", id, notificationBus.subscriberCount(id));
        return emitter;
    }

    SseEmitter createEmitter() {
        return new SseEmitter(streamTimeout.toMillis());
    }

    private static boolean send(SseEmitter emitter, SessionNotification notification) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(notification, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event stream of session {}: {}", notification.getSessionId(), e.getMessage());
            emitter.completeWithError(e);
            return false;
        }
    }

    /**
     * Holds back notifications until the snapshot is out, then forwards
     * those newer than it. Everything after the snapshot goes straight
     * through.
     */
    private static final class SessionStream {

        private final SseEmitter emitter;
        private final List<SessionNotification> early = new ArrayList<>();
        private SessionNotification snapshot;
        private boolean closed;

        SessionStream(SseEmitter emitter) {
            this.emitter = emitter;
        }

        synchronized void deliver(SessionNotification notification) {
            if (closed) {
                return;
            }
            if (snapshot == null) {
                early.add(notification);
                return;
            }
            forward(notification);
        }

        /**
         * @return false if the stream is already over
         */
        synchronized boolean start(SessionNotification current) {
            snapshot = current;
            if (!forward(current)) {
                return false;
            }
            for (SessionNotification notification : early) {
                boolean newer = notification.getStatus() != current.getStatus()
                        && notification.getProgress() >= current.getProgress();
                if (newer && !forward(notification)) {
                    break;
                }
            }
            early.clear();
            return !closed;
        }

        private boolean forward(SessionNotification notification) {
            if (!send(emitter, notification)) {
                closed = true;
                return false;
            }
            if (notification.getStatus().isTerminal()) {
                closed = true;
                emitter.complete();
                return false;
            }
            return true;
        }
    }
}
