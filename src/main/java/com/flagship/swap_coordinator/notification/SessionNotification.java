package com.flagship.swap_coordinator.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Status hint pushed to subscribers. Clients re-fetch the session for the
 * authoritative state.
 */
@Value
public class SessionNotification {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("status")
    SwapStatus status;

    @JsonProperty("phase")
    String phase;

    @JsonProperty("progress")
    int progress;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static SessionNotification of(SwapSession session, Instant at) {
        SwapStatus status = session.getStatus();
        return new SessionNotification(session.getSessionId(), status, status.phase(), status.progress(), at);
    }

    SessionNotification withProgress(int newProgress) {
        return new SessionNotification(sessionId, status, phase, newProgress, timestamp);
    }
}
