package com.flagship.swap_coordinator.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookup for session creation.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the session store (the key is stored with the session)
 * 3. Re-populate Redis after a store hit
 *
 * Redis is a cache only; a Redis outage never changes the answer.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final SessionStore sessionStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(SessionStore sessionStore,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.sessionStore = sessionStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the session created earlier under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String sessionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (sessionId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(sessionId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to session store. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing;
        try {
            existing = sessionStore.findIdByIdempotencyKey(idempotencyKey);
        } catch (RuntimeException e) {
            log.error("Session store lookup failed for idempotency key: {}. Error: {}",
                    idempotencyKey, e.getMessage());
            throw new IllegalStateException("Failed to check idempotency key", e);
        }

        existing.ifPresent(sessionId -> {
            log.debug("Idempotency key found in session store: {}", idempotencyKey);
            cache(idempotencyKey, sessionId);
        });
        return existing;
    }

    /**
     * Caches the key in Redis. The session store already holds it as part of
     * the session row.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID sessionId) {
        requireKey(idempotencyKey);
        if (sessionId == null) {
            throw new IllegalArgumentException("Session ID cannot be null");
        }
        cache(idempotencyKey, sessionId);
    }

    private void cache(String idempotencyKey, UUID sessionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, sessionId.toString(), REDIS_TTL);
            log.debug("Stored idempotency key in Redis: {} -> {}", idempotencyKey, sessionId);
        } catch (Exception e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
