package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.secret.Hashlocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Domain rules of a single session: edges, step effects and secret
 * attachment.
 */
class SwapSessionTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private String secret;
    private SwapSession session;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        secret = Hashlocks.newSecret(new SecureRandom());
        CreateSessionParams params = CreateSessionParams.builder()
                .sourceChain("base")
                .destinationChain("near")
                .sourceToken("0x2222222222222222222222222222222222222222")
                .destinationToken("usdc.near")
                .sourceAmount(new BigInteger("1000000"))
                .destinationAmount(new BigInteger("990000"))
                .maker("0x1111111111111111111111111111111111111111")
                .taker("taker.near")
                .slippageToleranceBps(50)
                .build();
        session = SwapSession.initialize(UUID.randomUUID(), params, Hashlocks.commit(secret),
                SwapFees.quote(params.getSourceAmount(), 30, Map.of()), NOW,
                Duration.ofHours(1), Duration.ofMinutes(5));
    }

    private SwapSession walk(SwapStatus... path) {
        SwapSession current = session;
        for (SwapStatus next : path) {
            current = current.transitionTo(next, NOW);
        }
        return current;
    }

    @Test
    @DisplayName("New session is initialized with five waiting steps and no legs")
    void initialize() {
        assertEquals(SwapStatus.INITIALIZED, session.getStatus());
        assertEquals(5, session.getSteps().size());
        assertTrue(session.getSteps().stream().allMatch(step -> step.getStatus() == StepStatus.WAITING));
        assertEquals(LegState.NONE, session.getSourceLeg().getState());
        assertEquals(NOW.plus(Duration.ofHours(1)), session.getExpirationTime());
        assertEquals(new BigInteger("3000"), session.getFees().getProtocolFeeAmount());
        assertNull(session.getSecret());
    }

    @Test
    @DisplayName("Transitions set step status as the session advances")
    void stepEffects() {
        SwapSession locking = walk(SwapStatus.EXECUTING, SwapStatus.SOURCE_LOCKING);
        assertEquals(StepStatus.COMPLETED, locking.stepStatus(StepName.INITIALIZE));
        assertEquals(StepStatus.IN_PROGRESS, locking.stepStatus(StepName.SOURCE_LOCK));
        assertEquals(StepStatus.WAITING, locking.stepStatus(StepName.DESTINATION_LOCK));
    }

    @Test
    @DisplayName("Invalid edge is rejected and leaves the session unchanged")
    void invalidEdge() {
        printTestHeader("Skip from initialized to both_locked");

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> session.transitionTo(SwapStatus.BOTH_LOCKED, NOW));
        printExpectedException("InvalidStateException", e.getMessage());

        assertEquals(SwapStatus.INITIALIZED, e.getCurrentStatus());
        assertEquals(SwapStatus.INITIALIZED, session.getStatus());
    }

    @Test
    @DisplayName("Cancelling marks refund in progress; cancelled fails the unfinished steps")
    void cancellationSteps() {
        SwapSession cancelling = walk(SwapStatus.EXECUTING, SwapStatus.SOURCE_LOCKING, SwapStatus.CANCELLING);
        assertEquals(StepStatus.IN_PROGRESS, cancelling.stepStatus(StepName.REFUND));
        assertEquals(6, cancelling.getSteps().size());

        SwapSession cancelled = cancelling.transitionTo(SwapStatus.CANCELLED, NOW);
        assertEquals(StepStatus.COMPLETED, cancelled.stepStatus(StepName.REFUND));
        assertEquals(StepStatus.COMPLETED, cancelled.stepStatus(StepName.INITIALIZE));
        assertEquals(StepStatus.FAILED, cancelled.stepStatus(StepName.SOURCE_LOCK));
        assertEquals(StepStatus.FAILED, cancelled.stepStatus(StepName.COMPLETE));
    }

    @Test
    @DisplayName("A mainline step cannot complete before the previous one")
    void stepOrder() {
        assertThrows(IllegalStateException.class,
                () -> session.withStep(StepName.DESTINATION_LOCK, StepStatus.COMPLETED, NOW));
    }

    @Test
    @DisplayName("Secret attaches only after both legs are locked and only if it opens the hashlock")
    void secretAttachment() {
        printTestHeader("Secret attachment");

        SwapSession sourceLocked = walk(SwapStatus.EXECUTING, SwapStatus.SOURCE_LOCKING, SwapStatus.SOURCE_LOCKED);
        assertThrows(InvalidStateException.class, () -> sourceLocked.withSecret(secret, NOW));

        SwapSession bothLocked = sourceLocked
                .transitionTo(SwapStatus.DESTINATION_LOCKING, NOW)
                .transitionTo(SwapStatus.BOTH_LOCKED, NOW);
        String wrong = Hashlocks.newSecret(new SecureRandom());
        assertThrows(IllegalStateException.class, () -> bothLocked.withSecret(wrong, NOW));

        SwapSession withSecret = bothLocked.withSecret(secret, NOW);
        assertEquals(secret, withSecret.getSecret());
        assertSame(withSecret, withSecret.withSecret(secret, NOW), "Attaching twice is a no-op");
        assertFalse(withSecret.toString().contains(secret.substring(2)), "Secret stays out of toString");
    }

    @Test
    @DisplayName("Escrow ids resolve to their side")
    void roleOfEscrow() {
        SwapSession withLegs = session
                .withLeg(session.getSourceLeg().submitted(NOW.plusSeconds(900), NOW).withEscrowId("src-1"), NOW)
                .withLeg(session.getDestinationLeg().submitted(NOW.plusSeconds(840), NOW).withEscrowId("dst-1"), NOW);

        assertEquals(ChainRole.SOURCE, withLegs.roleOfEscrow("src-1").orElseThrow());
        assertEquals(ChainRole.DESTINATION, withLegs.roleOfEscrow("dst-1").orElseThrow());
        assertTrue(withLegs.roleOfEscrow("other").isEmpty());
        assertTrue(withLegs.roleOfEscrow(null).isEmpty());
    }

    @Test
    @DisplayName("Time remaining counts down to expiration and is zero when terminal")
    void timeRemaining() {
        assertEquals(Duration.ofMinutes(45), session.timeRemaining(NOW.plus(Duration.ofMinutes(15))));
        assertEquals(Duration.ZERO, session.timeRemaining(NOW.plus(Duration.ofHours(2))));

        SwapSession cancelled = walk(SwapStatus.CANCELLING, SwapStatus.CANCELLED);
        assertEquals(Duration.ZERO, cancelled.timeRemaining(NOW));
    }
}
