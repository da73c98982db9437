package com.flagship.swap_coordinator.secret;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vault used together with the in-memory session store. Secrets are lost on
 * restart, which strands any session that was not yet disclosed.
 */
@Component
@ConditionalOnProperty(name = "swap.session-store", havingValue = "memory")
public class InMemorySecretVault implements SecretVault {

    private final Map<UUID, String> secrets = new ConcurrentHashMap<>();
    private final Map<UUID, Instant> disclosures = new ConcurrentHashMap<>();

    @Override
    public void store(UUID sessionId, String secret) {
        if (secrets.putIfAbsent(sessionId, secret) != null) {
            throw new IllegalStateException("Secret already generated for session " + sessionId);
        }
    }

    @Override
    public Optional<String> load(UUID sessionId) {
        return Optional.ofNullable(secrets.get(sessionId));
    }

    @Override
    public boolean markDisclosed(UUID sessionId, Instant at) {
        return disclosures.putIfAbsent(sessionId, at) == null;
    }

    @Override
    public void discard(UUID sessionId) {
        secrets.remove(sessionId);
        disclosures.remove(sessionId);
    }
}
