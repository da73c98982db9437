package com.flagship.swap_coordinator.secret;

import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.exception.SecretNotReadyException;
import com.flagship.swap_coordinator.exception.SessionNotFoundException;
import com.flagship.swap_coordinator.exception.UnauthorizedDisclosureException;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import com.flagship.swap_coordinator.session.SessionBackingStore;
import com.flagship.swap_coordinator.session.SwapSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/**
 * Generates swap secrets and gates their disclosure.
 *
 * The secret of a session is created here, sealed into the {@link SecretVault}
 * and handed out only to the session's taker once both escrows are locked.
 * It is never logged, never returned at creation and never part of any
 * event that leaves the process.
 *
 * Reads sessions straight from the {@link SessionBackingStore} so that it
 * can serve {@code SessionStore} without a dependency cycle. Disclosure is
 * only safe inside the session's mailbox, where the coordinator runs it
 * together with the move to {@code revealing_secret}.
 */
@Service
@Slf4j
public class SecretManager {

    private final SecretVault vault;
    private final SessionBackingStore sessions;
    private final SwapMetrics metrics;
    private final Clock clock;
    private final SecureRandom random;

    @Autowired
    public SecretManager(SecretVault vault, SessionBackingStore sessions, SwapMetrics metrics, Clock clock) {
        this(vault, sessions, metrics, clock, new SecureRandom());
    }

    SecretManager(SecretVault vault, SessionBackingStore sessions, SwapMetrics metrics, Clock clock,
                  SecureRandom random) {
        this.vault = vault;
        this.sessions = sessions;
        this.metrics = metrics;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Creates and stores a fresh 32-byte secret for the session.
     *
     * @return the hashlock commitment; the secret itself stays in the vault
     */
    public String generateCommitment(UUID sessionId) {
        String secret = Hashlocks.newSecret(random);
        vault.store(sessionId, secret);
        return Hashlocks.commit(secret);
    }

    /**
     * Hands the secret to the taker.
     *
     * Checks, in order: the session exists, the requester is its taker, both
     * escrows are locked. Repeated successful calls return the same secret.
     * Callers go through {@code CrossChainCoordinator.discloseSecret}.
     *
     * @throws SessionNotFoundException unknown session
     * @throws UnauthorizedDisclosureException requester is not the taker
     * @throws SecretNotReadyException both sides are not locked yet
     */
    public String discloseSecret(UUID sessionId, String requester) {
        SwapSession session = sessions.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        if (requester == null || !requester.equals(session.getTaker())) {
            metrics.recordDisclosure("unauthorized");
            log.warn("Rejected secret request for session {}: requester is not the taker", sessionId);
            throw new UnauthorizedDisclosureException(sessionId);
        }
        if (!session.getStatus().hasReachedBothLocked()) {
            metrics.recordDisclosure("not_ready");
            throw new SecretNotReadyException(sessionId, session.getStatus());
        }

        String secret = vault.load(sessionId)
                .orElseThrow(() -> new InvalidStateException(session.getStatus(),
                        "No secret in custody for session " + sessionId));
        if (!Hashlocks.matches(secret, session.getHashlock())) {
            throw new IllegalStateException("Secret in custody does not open hashlock of session " + sessionId);
        }

        boolean first = vault.markDisclosed(sessionId, clock.instant());
        if (first) {
            log.info("Secret disclosed to taker for session {}", sessionId);
        }
        metrics.recordDisclosure(first ? "disclosed" : "repeated");
        return secret;
    }

    public boolean verify(String secret, String commitment) {
        return Hashlocks.matches(secret, commitment);
    }

    /**
     * Drops the secret of a session that failed to persist.
     */
    public void discard(UUID sessionId) {
        vault.discard(sessionId);
    }
}
