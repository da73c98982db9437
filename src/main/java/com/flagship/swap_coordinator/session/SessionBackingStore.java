package com.flagship.swap_coordinator.session;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage seam behind {@link SessionStore}.
 *
 * Implementations only persist what they are given; state machine rules are
 * enforced above this interface. {@code save} receives the previous status
 * so a store can record the change as an event.
 */
public interface SessionBackingStore {

    /**
     * Persists a brand-new session. The idempotency key is a persistence
     * concern and may be null for internal callers.
     */
    SwapSession insert(SwapSession session, String idempotencyKey);

    SwapSession save(SwapSession session, SwapStatus previousStatus);

    Optional<SwapSession> findById(UUID sessionId);

    Optional<SwapSession> findByHashlock(String hashlock);

    Optional<SwapSession> findByEscrowId(String escrowId);

    Optional<UUID> findIdByIdempotencyKey(String idempotencyKey);

    List<SwapSession> list(SessionFilter filter);

    long countActive();
}
