package com.flagship.swap_coordinator.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backing store for tests and single-node local runs.
 * Sessions do not survive a restart.
 */
@Component
@ConditionalOnProperty(name = "swap.session-store", havingValue = "memory")
@Slf4j
public class InMemorySessionBackingStore implements SessionBackingStore {

    private final Map<UUID, SwapSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, UUID> idempotencyKeys = new ConcurrentHashMap<>();

    @Override
    public SwapSession insert(SwapSession session, String idempotencyKey) {
        if (sessions.putIfAbsent(session.getSessionId(), session) != null) {
            throw new IllegalStateException("Session already exists: " + session.getSessionId());
        }
        if (idempotencyKey != null && idempotencyKeys.putIfAbsent(idempotencyKey, session.getSessionId()) != null) {
            sessions.remove(session.getSessionId());
            throw new DataIntegrityViolationException("Duplicate idempotency key: " + idempotencyKey);
        }
        log.debug("Stored session {} in memory", session.getSessionId());
        return session;
    }

    @Override
    public SwapSession save(SwapSession session, SwapStatus previousStatus) {
        if (sessions.replace(session.getSessionId(), session) == null) {
            throw new IllegalArgumentException("Session not found: " + session.getSessionId());
        }
        return session;
    }

    @Override
    public Optional<SwapSession> findById(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<SwapSession> findByHashlock(String hashlock) {
        return sessions.values().stream()
                .filter(s -> s.getHashlock().equalsIgnoreCase(hashlock))
                .findFirst();
    }

    @Override
    public Optional<SwapSession> findByEscrowId(String escrowId) {
        return sessions.values().stream()
                .filter(s -> s.roleOfEscrow(escrowId).isPresent())
                .findFirst();
    }

    @Override
    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(idempotencyKeys.get(idempotencyKey));
    }

    @Override
    public List<SwapSession> list(SessionFilter filter) {
        return sessions.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(SwapSession::getCreatedAt).reversed())
                .skip(filter.getOffset())
                .limit(filter.getLimit())
                .toList();
    }

    @Override
    public long countActive() {
        return sessions.values().stream().filter(s -> !s.isTerminal()).count();
    }
}
