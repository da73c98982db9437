package com.flagship.swap_coordinator.secret;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Custody of per-session secrets. Only {@link SecretManager} talks to a
 * vault; nothing else in the service ever sees a secret before disclosure.
 */
public interface SecretVault {

    void store(UUID sessionId, String secret);

    Optional<String> load(UUID sessionId);

    /**
     * Records the first disclosure.
     *
     * @return true if this call was the first disclosure for the session
     */
    boolean markDisclosed(UUID sessionId, Instant at);

    void discard(UUID sessionId);
}
