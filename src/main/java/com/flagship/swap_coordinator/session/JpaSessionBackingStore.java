package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.outbox.OutboxService;
import com.flagship.swap_coordinator.secret.SecretSealer;
import com.flagship.swap_coordinator.session.event.SessionCreatedEvent;
import com.flagship.swap_coordinator.session.event.SessionStatusChangedEvent;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed session storage.
 *
 * Every insert and every status change also writes a fact to the outbox in
 * the same transaction, so the Kafka mirror of a session can never disagree
 * with the row. A revealed secret is stored sealed.
 */
@Component
@ConditionalOnProperty(name = "swap.session-store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaSessionBackingStore implements SessionBackingStore {

    static final String AGGREGATE_TYPE = "SwapSession";

    private static final EnumSet<SwapStatus> TERMINAL =
            EnumSet.of(SwapStatus.COMPLETED, SwapStatus.CANCELLED, SwapStatus.EXPIRED);

    private final SwapSessionRepository repository;
    private final OutboxService outboxService;
    private final SecretSealer sealer;

    @Override
    @Transactional
    public SwapSession insert(SwapSession session, String idempotencyKey) {
        SwapSessionEntity saved = repository.save(SwapSessionEntity.fromDomain(session, idempotencyKey, sealer));
        outboxService.saveEvent(AGGREGATE_TYPE, session.getSessionId(),
                SessionCreatedEvent.EVENT_TYPE, SessionCreatedEvent.fromSession(session));
        log.debug("Saved session {} with idempotency key {}", session.getSessionId(), idempotencyKey);
        return saved.toDomain(sealer);
    }

    @Override
    @Transactional
    public SwapSession save(SwapSession session, SwapStatus previousStatus) {
        SwapSessionEntity existing = repository.findById(session.getSessionId())
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + session.getSessionId()));

        existing.updateFromDomain(session, sealer);
        SwapSessionEntity updated = repository.save(existing);

        if (previousStatus != session.getStatus()) {
            outboxService.saveEvent(AGGREGATE_TYPE, session.getSessionId(),
                    SessionStatusChangedEvent.EVENT_TYPE, SessionStatusChangedEvent.of(previousStatus, session));
        }
        return updated.toDomain(sealer);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SwapSession> findById(UUID sessionId) {
        return repository.findById(sessionId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SwapSession> findByHashlock(String hashlock) {
        return repository.findByHashlockIgnoreCase(hashlock).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SwapSession> findByEscrowId(String escrowId) {
        return repository.findByEscrowId(escrowId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return repository.findIdByIdempotencyKey(idempotencyKey);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SwapSession> list(SessionFilter filter) {
        OffsetPageRequest page = new OffsetPageRequest(filter.getOffset(), filter.getLimit(),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return repository.findAll(toSpecification(filter), page)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive() {
        return repository.countByStatusNotIn(TERMINAL);
    }

    private SwapSession toDomain(SwapSessionEntity entity) {
        return entity.toDomain(sealer);
    }

    private static Specification<SwapSessionEntity> toSpecification(SessionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (!filter.getStatuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.getStatuses()));
            }
            if (filter.getMaker() != null) {
                predicates.add(cb.equal(root.get("maker"), filter.getMaker()));
            }
            if (filter.getTaker() != null) {
                predicates.add(cb.equal(root.get("taker"), filter.getTaker()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
