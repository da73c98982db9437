package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.exception.CapacityExceededException;
import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.exception.SessionNotFoundException;
import com.flagship.swap_coordinator.exception.SessionValidationException;
import com.flagship.swap_coordinator.secret.SecretManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * The durable record of every swap and the only way to change one.
 *
 * - {@link #transition} is the only mutator of status and rejects edges that
 *   are not in {@link SwapStatus}
 * - {@link #update} changes everything else and refuses to touch status
 * - Sessions are never deleted
 *
 * Callers are expected to serialize writes per session; the coordinator
 * does so through its per-session mailboxes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStore {

    private static final int MAX_SLIPPAGE_BPS = 10_000;

    private final SessionBackingStore backingStore;
    private final SecretManager secretManager;
    private final SessionPolicy policy;
    private final Clock clock;

    /**
     * Validates the parameters, obtains a fresh hashlock and persists the
     * session as INITIALIZED.
     *
     * @throws SessionValidationException if any parameter is malformed
     * @throws CapacityExceededException if too many sessions are active
     */
    public SwapSession create(UUID sessionId, CreateSessionParams params, String idempotencyKey) {
        validate(params);

        long active = backingStore.countActive();
        if (active >= policy.getMaxActiveSessions()) {
            throw new CapacityExceededException(active, policy.getMaxActiveSessions());
        }

        String hashlock = secretManager.generateCommitment(sessionId);
        SwapFees fees = SwapFees.quote(params.getSourceAmount(), policy.getProtocolFeeBps(), policy.getNetworkFees());
        SwapSession session = SwapSession.initialize(sessionId, params, hashlock, fees,
                clock.instant(), policy.getTtl(), policy.getEstimatedCompletion());

        try {
            SwapSession saved = backingStore.insert(session, idempotencyKey);
            log.info("Created session {}: {} {} on {} -> {} {} on {}, expires {}",
                    sessionId, params.getSourceAmount(), params.getSourceToken(), params.getSourceChain(),
                    params.getDestinationAmount(), params.getDestinationToken(), params.getDestinationChain(),
                    saved.getExpirationTime());
            return saved;
        } catch (RuntimeException e) {
            secretManager.discard(sessionId);
            throw e;
        }
    }

    public SwapSession create(CreateSessionParams params) {
        return create(UUID.randomUUID(), params, null);
    }

    public SwapSession get(UUID sessionId) {
        return backingStore.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<SwapSession> find(UUID sessionId) {
        return backingStore.findById(sessionId);
    }

    public SwapSession transition(UUID sessionId, SwapStatus next) {
        return transition(sessionId, next, UnaryOperator.identity());
    }

    /**
     * Moves the session one edge and applies {@code alongside} to the result
     * before saving, so a status change and the data that justifies it are
     * stored together.
     *
     * @throws InvalidStateException if the edge does not exist
     */
    public SwapSession transition(UUID sessionId, SwapStatus next, UnaryOperator<SwapSession> alongside) {
        SwapSession current = get(sessionId);
        SwapSession moved = alongside.apply(current.transitionTo(next, clock.instant()));
        if (moved.getStatus() != next) {
            throw new IllegalStateException("Status may only change through transition(): session " + sessionId);
        }
        SwapSession saved = backingStore.save(moved, current.getStatus());
        log.info("Session {} transitioned {} -> {}", sessionId, current.getStatus().wireName(), next.wireName());
        return saved;
    }

    /**
     * Applies a change that leaves status untouched (escrow legs, secret,
     * degraded flag, step history).
     */
    public SwapSession update(UUID sessionId, UnaryOperator<SwapSession> mutation) {
        SwapSession current = get(sessionId);
        SwapSession changed = mutation.apply(current);
        if (changed.getStatus() != current.getStatus()) {
            throw new InvalidStateException(current.getStatus(),
                    "Status may only change through transition(): session " + sessionId);
        }
        if (changed.equals(current)) {
            return current;
        }
        return backingStore.save(changed, current.getStatus());
    }

    public List<SwapSession> list(SessionFilter filter) {
        return backingStore.list(filter);
    }

    public Optional<SwapSession> findByHashlock(String hashlock) {
        return backingStore.findByHashlock(hashlock);
    }

    public Optional<SwapSession> findByEscrowId(String escrowId) {
        return backingStore.findByEscrowId(escrowId);
    }

    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return backingStore.findIdByIdempotencyKey(idempotencyKey);
    }

    public long countActive() {
        return backingStore.countActive();
    }

    private void validate(CreateSessionParams params) {
        Map<String, String> errors = new LinkedHashMap<>();

        String source = params.getSourceChain();
        String destination = params.getDestinationChain();
        if (isBlank(source) || !policy.getSourceChains().contains(source)) {
            errors.put("source_chain", "Must be one of " + policy.getSourceChains());
        }
        if (isBlank(destination) || !policy.getDestinationChains().contains(destination)) {
            errors.put("destination_chain", "Must be one of " + policy.getDestinationChains());
        }
        if (!isBlank(source) && source.equals(destination)) {
            errors.put("destination_chain", "Must differ from source_chain");
        }

        checkIdentifier(errors, "source_token", params.getSourceToken(), policy.getTokenPatterns().get(source));
        checkIdentifier(errors, "destination_token", params.getDestinationToken(),
                policy.getTokenPatterns().get(destination));
        checkIdentifier(errors, "maker", params.getMaker(), policy.getAddressPatterns().get(source));
        checkIdentifier(errors, "taker", params.getTaker(), policy.getAddressPatterns().get(destination));
        if (!isBlank(params.getMaker()) && params.getMaker().equals(params.getTaker())) {
            errors.put("taker", "Must differ from maker");
        }

        checkPositive(errors, "source_amount", params.getSourceAmount());
        checkPositive(errors, "destination_amount", params.getDestinationAmount());

        Integer slippage = params.getSlippageToleranceBps();
        if (slippage == null || slippage < 0 || slippage > MAX_SLIPPAGE_BPS) {
            errors.put("slippage_tolerance", "Must be between 0 and " + MAX_SLIPPAGE_BPS + " basis points");
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected session parameters: {}", errors);
            throw new SessionValidationException(errors);
        }
    }

    private static void checkIdentifier(Map<String, String> errors, String field, String value, Pattern pattern) {
        if (isBlank(value)) {
            errors.put(field, "Is required");
        } else if (pattern != null && !pattern.matcher(value).matches()) {
            errors.put(field, "Does not match " + pattern.pattern());
        }
    }

    private static void checkPositive(Map<String, String> errors, String field, BigInteger value) {
        if (value == null || value.signum() <= 0) {
            errors.put(field, "Must be a positive integer amount");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
