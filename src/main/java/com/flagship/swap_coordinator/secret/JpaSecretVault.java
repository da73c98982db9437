package com.flagship.swap_coordinator.secret;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed vault. Secrets are sealed with {@link SecretSealer} before
 * they reach the table.
 */
@Component
@ConditionalOnProperty(name = "swap.session-store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaSecretVault implements SecretVault {

    private final SealedSecretRepository repository;
    private final SecretSealer sealer;
    private final Clock clock;

    @Override
    @Transactional
    public void store(UUID sessionId, String secret) {
        if (repository.existsById(sessionId)) {
            throw new IllegalStateException("Secret already generated for session " + sessionId);
        }
        repository.save(SealedSecretEntity.create(sessionId, sealer.seal(sessionId, secret), clock.instant()));
        log.debug("Sealed secret stored for session {}", sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> load(UUID sessionId) {
        return repository.findById(sessionId)
                .map(entity -> sealer.open(sessionId, entity.getSealedSecret()));
    }

    @Override
    @Transactional
    public boolean markDisclosed(UUID sessionId, Instant at) {
        return repository.markDisclosed(sessionId, at) == 1;
    }

    @Override
    @Transactional
    public void discard(UUID sessionId) {
        repository.deleteById(sessionId);
    }
}
