package com.flagship.swap_coordinator.coordinator;

import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.exception.SecretNotReadyException;
import com.flagship.swap_coordinator.exception.UnauthorizedExecutionException;
import com.flagship.swap_coordinator.notification.SessionNotification;
import com.flagship.swap_coordinator.observer.LedgerEvent;
import com.flagship.swap_coordinator.session.ChainRole;
import com.flagship.swap_coordinator.session.LegState;
import com.flagship.swap_coordinator.session.StepName;
import com.flagship.swap_coordinator.session.StepStatus;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import com.flagship.swap_coordinator.session.SwapStep;
import com.flagship.swap_coordinator.support.CoordinatorHarness;
import com.flagship.swap_coordinator.support.PausableExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coordinator tests against fake ledgers, a manual clock and synchronous
 * workers.
 *
 * These tests verify:
 * - The happy path from creation to completion
 * - Timeout and explicit cancellation, with refunds destination first
 * - Expiry after both sides are locked, and its race with disclosure
 * - Refunds never requested before an escrow's timelock
 * - Duplicate and late ledger events
 * - Retry, rejection and the degraded flag
 * - The maker-only execution rule
 */
class CrossChainCoordinatorTest {

    private CoordinatorHarness harness;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
    }

    private SwapSession session(UUID id) {
        return harness.session(id);
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long giveUpAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > giveUpAt) {
                fail("Condition not reached within 5 seconds");
            }
            Thread.onSpinWait();
        }
    }

    @Nested
    @DisplayName("1. Happy path")
    class HappyPath {

        @Test
        @DisplayName("1.1 Session goes from initialized to completed in order")
        void fullSwapCompletes() {
            printTestHeader("Full swap: create, execute, lock both sides, disclose, withdraw");

            UUID id = harness.open();
            assertEquals(SwapStatus.INITIALIZED, session(id).getStatus());

            SwapSession executing = harness.coordinator.executeSwap(id, harness.makerAuthorization());
            assertEquals(SwapStatus.EXECUTING, executing.getStatus());
            assertEquals(SwapStatus.SOURCE_LOCKING, session(id).getStatus());
            assertEquals(1, harness.source.lockRequests.size());
            assertEquals("0xdeadbeef", harness.source.lockRequests.get(0).getAuthorizationSignature());
            assertEquals(CoordinatorHarness.TAKER, harness.source.lockRequests.get(0).getBeneficiary());

            harness.confirmLock(id, ChainRole.SOURCE);
            assertEquals(SwapStatus.DESTINATION_LOCKING, session(id).getStatus());
            assertEquals(1, harness.destination.lockRequests.size());
            assertEquals(CoordinatorHarness.TAKER, harness.destination.lockRequests.get(0).getDepositor());
            assertEquals(CoordinatorHarness.MAKER, harness.destination.lockRequests.get(0).getBeneficiary());

            harness.confirmLock(id, ChainRole.DESTINATION);
            assertEquals(SwapStatus.BOTH_LOCKED, session(id).getStatus());

            String secret = harness.disclose(id);
            SwapSession revealing = session(id);
            assertEquals(SwapStatus.REVEALING_SECRET, revealing.getStatus());
            assertEquals(secret, revealing.getSecret());
            assertEquals(List.of(revealing.getDestinationLeg().getEscrowId()), harness.destination.withdrawals);
            assertEquals(List.of(secret), harness.destination.withdrawSecrets);

            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);
            SwapSession completed = session(id);
            printOutput("Final session", completed);

            assertEquals(SwapStatus.COMPLETED, completed.getStatus());
            assertEquals(LegState.WITHDRAWN, completed.getDestinationLeg().getState());
            assertTrue(completed.getSteps().stream().allMatch(step -> step.getStatus() == StepStatus.COMPLETED));
            assertNull(completed.stepStatus(StepName.REFUND));
            assertTrue(harness.timers.deadline(id).isEmpty(), "No timer after completion");
            printSuccess("Swap completed with every mainline step completed");
        }

        @Test
        @DisplayName("1.2 Notifications follow the status path with non-decreasing progress")
        void notificationsAreOrdered() {
            printTestHeader("Notification order");

            UUID id = harness.toBothLocked();
            String secret = harness.disclose(id);
            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);

            List<SwapStatus> statuses = harness.published.stream().map(SessionNotification::getStatus).toList();
            printOutput("Statuses", statuses);
            assertEquals(List.of(
                    SwapStatus.INITIALIZED,
                    SwapStatus.EXECUTING,
                    SwapStatus.SOURCE_LOCKING,
                    SwapStatus.SOURCE_LOCKED,
                    SwapStatus.DESTINATION_LOCKING,
                    SwapStatus.BOTH_LOCKED,
                    SwapStatus.REVEALING_SECRET,
                    SwapStatus.COMPLETED), statuses);

            int previous = -1;
            for (SessionNotification notification : harness.published) {
                assertTrue(notification.getProgress() >= previous);
                previous = notification.getProgress();
            }
            assertEquals(100, previous);
            printSuccess("Eight notifications in status order");
        }

        @Test
        @DisplayName("1.3 Repeated disclosure returns the same secret and submits one withdrawal")
        void repeatedDisclosure() {
            printTestHeader("Repeated disclosure");

            UUID id = harness.toBothLocked();
            String first = harness.disclose(id);
            String second = harness.disclose(id);

            assertEquals(first, second);
            assertEquals(1, harness.destination.withdrawals.size());
            printSuccess("Second disclosure had no further effect");
        }

        @Test
        @DisplayName("1.4 A withdrawal seen on chain before disclosure still completes the swap")
        void externalRevealCompletes() {
            printTestHeader("Secret revealed on the destination ledger first");

            UUID id = harness.toBothLocked();
            String secret = harness.vault.load(id).orElseThrow();
            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);

            SwapSession completed = session(id);
            assertEquals(SwapStatus.COMPLETED, completed.getStatus());
            assertEquals(secret, completed.getSecret());
            printSuccess("Caught up through revealing_secret to completed");
        }
    }

    @Nested
    @DisplayName("2. Authorization and state rules")
    class Authorization {

        @Test
        @DisplayName("2.1 Only the maker can start a swap")
        void nonMakerCannotExecute() {
            printTestHeader("Execution signed by someone else");

            UUID id = harness.open();
            SwapAuthorization forged = SwapAuthorization.builder()
                    .signer("0x9999999999999999999999999999999999999999")
                    .signature("0xdeadbeef")
                    .build();

            assertThrows(UnauthorizedExecutionException.class, () -> harness.coordinator.executeSwap(id, forged));
            assertEquals(SwapStatus.INITIALIZED, session(id).getStatus());
            assertTrue(harness.source.lockRequests.isEmpty());
            printSuccess("Rejected and nothing submitted");
        }

        @Test
        @DisplayName("2.2 An unsigned authorization is rejected")
        void missingSignature() {
            UUID id = harness.open();
            SwapAuthorization unsigned = SwapAuthorization.builder()
                    .signer(CoordinatorHarness.MAKER)
                    .signature(" ")
                    .build();

            assertThrows(UnauthorizedExecutionException.class, () -> harness.coordinator.executeSwap(id, unsigned));
            assertEquals(SwapStatus.INITIALIZED, session(id).getStatus());
        }

        @Test
        @DisplayName("2.3 Executing twice is an invalid state")
        void executeTwice() {
            UUID id = harness.openAndExecute();

            assertThrows(InvalidStateException.class,
                    () -> harness.coordinator.executeSwap(id, harness.makerAuthorization()));
            assertEquals(1, harness.source.lockRequests.size());
        }

        @Test
        @DisplayName("2.4 Cancel is refused once both sides are locked")
        void cancelAfterBothLocked() {
            UUID id = harness.toBothLocked();

            assertThrows(InvalidStateException.class, () -> harness.coordinator.cancelSwap(id));
            assertEquals(SwapStatus.BOTH_LOCKED, session(id).getStatus());
        }

        @Test
        @DisplayName("2.5 Cancelling twice is a no-op")
        void cancelTwice() {
            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);

            SwapSession first = harness.coordinator.cancelSwap(id);
            SwapSession second = harness.coordinator.cancelSwap(id);

            assertEquals(SwapStatus.CANCELLING, first.getStatus());
            assertEquals(SwapStatus.CANCELLING, second.getStatus());
        }
    }

    @Nested
    @DisplayName("3. Idempotence")
    class Idempotence {

        @Test
        @DisplayName("3.1 A duplicated lock confirmation changes nothing")
        void duplicateLockConfirmation() {
            printTestHeader("Duplicate source lock confirmation");

            UUID id = harness.openAndExecute();
            SwapSession locking = session(id);
            LedgerEvent event = harness.lockEvent(locking, ChainRole.SOURCE, locking.getSourceLeg().getEscrowId());

            harness.coordinator.onLedgerEvent(event);
            SwapSession afterFirst = session(id);
            harness.coordinator.onLedgerEvent(event);
            SwapSession afterSecond = session(id);

            assertEquals(SwapStatus.DESTINATION_LOCKING, afterSecond.getStatus());
            assertEquals(afterFirst, afterSecond);
            assertEquals(1, harness.destination.lockRequests.size());
            assertEquals(1.0, harness.counter("swap.ledger.events", "outcome", "duplicate"));
            printSuccess("Second delivery recorded as duplicate");
        }

        @Test
        @DisplayName("3.2 A lock confirmation that arrives out of order is ignored")
        void outOfOrderConfirmation() {
            UUID id = harness.openAndExecute();
            SwapSession session = session(id);

            harness.coordinator.onLedgerEvent(harness.lockEvent(session, ChainRole.DESTINATION, "near-escrow-x"));

            assertEquals(SwapStatus.SOURCE_LOCKING, session(id).getStatus());
            assertEquals(LegState.NONE, session(id).getDestinationLeg().getState());
        }

        @Test
        @DisplayName("3.3 A lock by the wrong party or for too little is rejected")
        void mismatchedLock() {
            UUID id = harness.openAndExecute();
            SwapSession session = session(id);
            LedgerEvent valid = harness.lockEvent(session, ChainRole.SOURCE, session.getSourceLeg().getEscrowId());

            harness.coordinator.onLedgerEvent(valid.toBuilder().party("0x3333333333333333333333333333333333333333").build());
            harness.coordinator.onLedgerEvent(valid.toBuilder().eventId("short").amount(BigInteger.ONE).build());

            assertEquals(SwapStatus.SOURCE_LOCKING, session(id).getStatus());
            assertEquals(2.0, harness.counter("swap.ledger.events", "outcome", "rejected"));
        }

        @Test
        @DisplayName("3.4 Events for unknown hashlocks are dropped")
        void unmatchedEvent() {
            UUID id = harness.openAndExecute();
            LedgerEvent stray = harness.lockEvent(session(id), ChainRole.SOURCE, "base-escrow-x").toBuilder()
                    .hashlock("0x" + "ab".repeat(32))
                    .build();

            harness.coordinator.onLedgerEvent(stray);

            assertEquals(SwapStatus.SOURCE_LOCKING, session(id).getStatus());
            assertEquals(1.0, harness.counter("swap.ledger.events", "outcome", "unmatched"));
        }

        @Test
        @DisplayName("3.5 A withdrawal with the wrong secret does not complete the swap")
        void wrongSecret() {
            UUID id = harness.toBothLocked();
            harness.confirmWithdraw(id, ChainRole.DESTINATION, "0x" + "00".repeat(32));

            assertEquals(SwapStatus.BOTH_LOCKED, session(id).getStatus());
        }

        @Test
        @DisplayName("3.6 A duplicated withdrawal confirmation changes nothing")
        void duplicateWithdrawConfirmation() {
            printTestHeader("Duplicate destination withdrawal");

            UUID id = harness.toBothLocked();
            String secret = harness.disclose(id);
            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);
            SwapSession afterFirst = session(id);
            int notifications = harness.published.size();

            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);
            SwapSession afterSecond = session(id);

            assertEquals(SwapStatus.COMPLETED, afterSecond.getStatus());
            assertEquals(afterFirst, afterSecond);
            assertEquals(notifications, harness.published.size(), "No second completed notification");
            assertEquals(1, harness.destination.withdrawals.size());
            assertEquals(1.0, harness.counter("swap.ledger.events", "outcome", "duplicate"));
            printSuccess("Second withdrawal recorded as duplicate");
        }

        @Test
        @DisplayName("3.7 A duplicated refund confirmation changes nothing")
        void duplicateRefundConfirmation() {
            printTestHeader("Duplicate source refund");

            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);
            harness.coordinator.cancelSwap(id);
            harness.scheduler.advanceTo(session(id).getSourceLeg().getCancellationDeadline());
            assertEquals(1, harness.source.refunds.size());

            harness.confirmRefund(id, ChainRole.SOURCE);
            SwapSession afterFirst = session(id);
            harness.confirmRefund(id, ChainRole.SOURCE);
            SwapSession afterSecond = session(id);

            assertEquals(SwapStatus.CANCELLED, afterSecond.getStatus());
            assertEquals(afterFirst, afterSecond);
            assertEquals(1, harness.source.refunds.size());
            assertEquals(1.0, harness.counter("swap.ledger.events", "outcome", "duplicate"));
            printSuccess("Second refund recorded as duplicate");
        }
    }

    @Nested
    @DisplayName("4. Timeouts and cancellation")
    class Cancellation {

        @Test
        @DisplayName("4.1 Unconfirmed source lock times out, is abandoned at its deadline, session cancelled")
        void sourceLockTimeout() {
            printTestHeader("Timeout before the source lock is confirmed");

            Instant start = harness.clock.instant();
            UUID id = harness.openAndExecute();
            assertEquals(start.plus(Duration.ofMinutes(14)), harness.timers.deadline(id).orElseThrow());

            harness.scheduler.advance(Duration.ofMinutes(14));
            SwapSession cancelling = session(id);
            assertEquals(SwapStatus.CANCELLING, cancelling.getStatus());
            assertEquals("timeout", cancelling.getCancellationReason());
            assertEquals(StepStatus.IN_PROGRESS, cancelling.stepStatus(StepName.REFUND));

            harness.scheduler.advance(Duration.ofMinutes(1));
            SwapSession cancelled = session(id);
            printOutput("Final session", cancelled);

            assertEquals(SwapStatus.CANCELLED, cancelled.getStatus());
            assertEquals(LegState.ABANDONED, cancelled.getSourceLeg().getState());
            assertEquals(StepStatus.COMPLETED, cancelled.stepStatus(StepName.REFUND));
            assertEquals(StepStatus.FAILED, cancelled.stepStatus(StepName.SOURCE_LOCK));
            assertEquals(StepStatus.COMPLETED, cancelled.stepStatus(StepName.INITIALIZE));
            assertTrue(harness.source.refunds.isEmpty());
            printSuccess("Cancelled without any refund request");
        }

        @Test
        @DisplayName("4.2 A session never executed is cancelled at expiration")
        void idleSessionExpires() {
            UUID id = harness.open();

            harness.scheduler.advance(Duration.ofHours(1));

            assertEquals(SwapStatus.CANCELLED, session(id).getStatus());
            assertEquals("timeout", session(id).getCancellationReason());
        }

        @Test
        @DisplayName("4.3 Cancel with only the source locked refunds the source")
        void cancelAfterSourceLocked() {
            printTestHeader("Explicit cancel while the destination lock is pending");

            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);
            String sourceEscrow = session(id).getSourceLeg().getEscrowId();

            harness.coordinator.cancelSwap(id);
            SwapSession cancelling = session(id);
            assertEquals(SwapStatus.CANCELLING, cancelling.getStatus());
            assertEquals("requested", cancelling.getCancellationReason());
            assertTrue(harness.source.refunds.isEmpty(), "Source refund waits for the destination leg");

            Instant destinationDeadline = cancelling.getDestinationLeg().getCancellationDeadline();
            Instant sourceDeadline = cancelling.getSourceLeg().getCancellationDeadline();
            harness.scheduler.advanceTo(destinationDeadline);

            SwapSession waiting = session(id);
            assertEquals(LegState.ABANDONED, waiting.getDestinationLeg().getState());
            assertEquals(LegState.LOCKED, waiting.getSourceLeg().getState());
            assertTrue(harness.source.refunds.isEmpty(), "Source escrow is not refundable yet");
            assertEquals(sourceDeadline, harness.timers.deadline(id).orElseThrow());

            harness.scheduler.advanceTo(sourceDeadline);
            SwapSession refunding = session(id);
            assertEquals(LegState.REFUND_REQUESTED, refunding.getSourceLeg().getState());
            assertEquals(List.of(sourceEscrow), harness.source.refunds);
            assertTrue(harness.source.earlyRefunds.isEmpty());

            harness.confirmRefund(id, ChainRole.SOURCE);
            SwapSession cancelled = session(id);
            assertEquals(SwapStatus.CANCELLED, cancelled.getStatus());
            assertEquals(LegState.REFUNDED, cancelled.getSourceLeg().getState());
            printSuccess("Source refunded after the destination leg was settled");
        }

        @Test
        @DisplayName("4.4 Destination is refunded before source")
        void refundsDestinationFirst() {
            printTestHeader("Ordered refunds");

            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);
            harness.coordinator.cancelSwap(id);

            // destination lock lands after cancellation started
            harness.confirmLock(id, ChainRole.DESTINATION);
            SwapSession session = session(id);
            assertEquals(SwapStatus.CANCELLING, session.getStatus());
            assertEquals(LegState.LOCKED, session.getDestinationLeg().getState());
            assertEquals(LegState.LOCKED, session.getSourceLeg().getState());
            assertTrue(harness.destination.refunds.isEmpty(), "Destination waits for its timelock");

            harness.scheduler.advanceTo(session.getDestinationLeg().getCancellationDeadline());
            assertEquals(LegState.REFUND_REQUESTED, session(id).getDestinationLeg().getState());
            assertEquals(1, harness.destination.refunds.size());
            assertTrue(harness.source.refunds.isEmpty());

            harness.confirmRefund(id, ChainRole.DESTINATION);
            assertTrue(harness.source.refunds.isEmpty(), "Source waits for its own timelock");
            harness.scheduler.advanceTo(session.getSourceLeg().getCancellationDeadline());
            assertEquals(1, harness.source.refunds.size());
            assertEquals(LegState.REFUND_REQUESTED, session(id).getSourceLeg().getState());

            harness.confirmRefund(id, ChainRole.SOURCE);
            assertEquals(SwapStatus.CANCELLED, session(id).getStatus());
            printSuccess("Refunds went destination, then source");
        }

        @Test
        @DisplayName("4.5 A lock confirmed after cancellation is refunded")
        void lateLockIsRefunded() {
            printTestHeader("Late lock");

            UUID id = harness.open();
            harness.coordinator.cancelSwap(id);
            assertEquals(SwapStatus.CANCELLED, session(id).getStatus());

            harness.coordinator.onLedgerEvent(harness.lockEvent(session(id), ChainRole.SOURCE, "base-escrow-late"));

            SwapSession session = session(id);
            assertEquals(SwapStatus.CANCELLED, session.getStatus());
            assertEquals(LegState.REFUND_REQUESTED, session.getSourceLeg().getState());
            assertEquals(List.of("base-escrow-late"), harness.source.refunds);
            printSuccess("Refund requested without a status change");
        }

        @Test
        @DisplayName("4.6 Destination lock never confirmed: the timer cancels, abandons it and refunds the source")
        void destinationLockTimeout() {
            printTestHeader("Timeout while the destination lock is pending");

            Instant start = harness.clock.instant();
            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);
            SwapSession locking = session(id);
            assertEquals(SwapStatus.DESTINATION_LOCKING, locking.getStatus());
            Instant sourceDeadline = locking.getSourceLeg().getCancellationDeadline();
            assertEquals(start.plus(Duration.ofMinutes(14)), harness.timers.deadline(id).orElseThrow());

            harness.scheduler.advance(Duration.ofMinutes(14));
            SwapSession cancelling = session(id);
            assertEquals(SwapStatus.CANCELLING, cancelling.getStatus());
            assertEquals("timeout", cancelling.getCancellationReason());
            assertEquals(LegState.ABANDONED, cancelling.getDestinationLeg().getState());
            assertEquals(LegState.LOCKED, cancelling.getSourceLeg().getState());
            assertTrue(harness.source.refunds.isEmpty());
            assertEquals(sourceDeadline, harness.timers.deadline(id).orElseThrow());

            harness.scheduler.advanceTo(sourceDeadline);
            assertEquals(LegState.REFUND_REQUESTED, session(id).getSourceLeg().getState());
            assertEquals(List.of(locking.getSourceLeg().getEscrowId()), harness.source.refunds);

            harness.confirmRefund(id, ChainRole.SOURCE);
            SwapSession cancelled = session(id);
            printOutput("Final session", cancelled);
            assertEquals(SwapStatus.CANCELLED, cancelled.getStatus());
            assertEquals(LegState.REFUNDED, cancelled.getSourceLeg().getState());
            assertTrue(harness.destination.refunds.isEmpty());
            assertTrue(harness.source.earlyRefunds.isEmpty());
            printSuccess("Maker refunded without any explicit cancel");
        }

        @Test
        @DisplayName("4.7 A refund the ledger refuses is retried, not given up")
        void rejectedRefundIsRetried() {
            printTestHeader("Ledger refuses the first refund");

            UUID id = harness.openAndExecute();
            harness.confirmLock(id, ChainRole.SOURCE);
            harness.coordinator.cancelSwap(id);
            harness.source.rejectNextSubmission("escrow not yet refundable");

            harness.scheduler.advanceTo(session(id).getSourceLeg().getCancellationDeadline());
            SwapSession rejected = session(id);
            assertTrue(harness.source.refunds.isEmpty());
            assertTrue(rejected.isDegraded());
            assertEquals("refund_rejected", rejected.getDegradedReason());
            assertEquals(LegState.REFUND_REQUESTED, rejected.getSourceLeg().getState());

            harness.scheduler.advance(Duration.ofSeconds(1));
            assertEquals(1, harness.source.refunds.size());

            harness.confirmRefund(id, ChainRole.SOURCE);
            assertEquals(SwapStatus.CANCELLED, session(id).getStatus());
            printSuccess("Refund accepted on the retry");
        }
    }

    @Nested
    @DisplayName("5. Expiry")
    class Expiry {

        @Test
        @DisplayName("5.1 Both locked but no disclosure: expired, then refunded destination first")
        void expiresAndRefunds() {
            printTestHeader("Expiry after both locks");

            UUID id = harness.toBothLocked();
            Instant actBy = session(id).getDestinationLeg().getCancellationDeadline().minus(Duration.ofMinutes(1));
            assertEquals(actBy, harness.timers.deadline(id).orElseThrow());

            harness.scheduler.advanceTo(actBy);
            SwapSession expired = session(id);
            assertEquals(SwapStatus.EXPIRED, expired.getStatus());
            assertEquals("expired", expired.getCancellationReason());
            assertEquals(StepStatus.FAILED, expired.stepStatus(StepName.REVEAL_SECRET));
            assertTrue(harness.destination.refunds.isEmpty(), "Expired one margin before the timelock");

            harness.scheduler.advanceTo(expired.getDestinationLeg().getCancellationDeadline());
            assertEquals(1, harness.destination.refunds.size());
            assertTrue(harness.source.refunds.isEmpty());

            harness.confirmRefund(id, ChainRole.DESTINATION);
            harness.scheduler.advanceTo(expired.getSourceLeg().getCancellationDeadline());
            assertEquals(1, harness.source.refunds.size());

            harness.confirmRefund(id, ChainRole.SOURCE);
            SwapSession refunded = session(id);
            assertEquals(SwapStatus.EXPIRED, refunded.getStatus());
            assertEquals(StepStatus.COMPLETED, refunded.stepStatus(StepName.REFUND));
            assertTrue(harness.destination.earlyRefunds.isEmpty());
            assertTrue(harness.source.earlyRefunds.isEmpty());
            assertTrue(harness.timers.deadline(id).isEmpty());
            printSuccess("Both sides refunded after expiry");
        }

        @Test
        @DisplayName("5.2 Disclosure after expiry is refused")
        void noDisclosureAfterExpiry() {
            UUID id = harness.toBothLocked();
            harness.scheduler.advance(Duration.ofHours(1));

            assertEquals(SwapStatus.EXPIRED, session(id).getStatus());
            assertThrows(SecretNotReadyException.class, () -> harness.disclose(id));
        }

        @Test
        @DisplayName("5.3 Disclosure queued behind the expiry deadline is refused")
        void disclosureAfterQueuedExpiry() {
            printTestHeader("Expiry task ahead of the disclosure in the mailbox");

            PausableExecutor executor = new PausableExecutor();
            harness = new CoordinatorHarness(executor);
            UUID id = harness.toBothLocked();
            SwapSession bothLocked = session(id);

            executor.pause();
            harness.scheduler.advanceTo(harness.timers.deadline(id).orElseThrow());
            assertEquals(1, executor.queued());
            assertEquals(SwapStatus.BOTH_LOCKED, session(id).getStatus(), "Expiry not applied yet");

            CompletableFuture<String> disclosure = CompletableFuture.supplyAsync(() -> harness.disclose(id));
            awaitCondition(() -> {
                executor.drain();
                return disclosure.isDone();
            });
            executor.resume();

            CompletionException refused = assertThrows(CompletionException.class, disclosure::join);
            printOutput("Disclosure", refused.getCause());
            assertInstanceOf(SecretNotReadyException.class, refused.getCause());
            assertEquals(SwapStatus.EXPIRED, session(id).getStatus());
            assertTrue(harness.destination.withdrawals.isEmpty());
            assertTrue(harness.vault.markDisclosed(id, harness.clock.instant()), "Secret never left custody");

            harness.scheduler.advanceTo(bothLocked.getDestinationLeg().getCancellationDeadline());
            assertEquals(List.of(bothLocked.getDestinationLeg().getEscrowId()), harness.destination.refunds);
            printSuccess("Taker refused; destination refunded at its timelock");
        }

        @Test
        @DisplayName("5.4 Disclosure queued ahead of the expiry deadline completes the reveal")
        void disclosureBeforeQueuedExpiry() {
            printTestHeader("Disclosure ahead of the expiry task in the mailbox");

            PausableExecutor executor = new PausableExecutor();
            harness = new CoordinatorHarness(executor);
            UUID id = harness.toBothLocked();
            Instant expiresAt = harness.timers.deadline(id).orElseThrow();

            executor.pause();
            CompletableFuture<String> disclosure = CompletableFuture.supplyAsync(() -> harness.disclose(id));
            awaitCondition(() -> executor.queued() == 1);
            harness.scheduler.advanceTo(expiresAt);
            executor.resume();

            String secret = disclosure.join();
            SwapSession session = session(id);
            printOutput("Session", session);
            assertEquals(SwapStatus.REVEALING_SECRET, session.getStatus());
            assertEquals(List.of(secret), harness.destination.withdrawSecrets);
            assertTrue(harness.destination.refunds.isEmpty());
            assertTrue(harness.timers.deadline(id).isEmpty());
            printSuccess("Reveal won; the expiry tick found nothing to do");
        }
    }

    @Nested
    @DisplayName("6. Ledger failures")
    class LedgerFailures {

        @Test
        @DisplayName("6.1 Transient failures are retried with backoff")
        void retriesThenSucceeds() {
            printTestHeader("Source lock succeeds on the third attempt");

            harness.source.failNextSubmissions(2);
            UUID id = harness.openAndExecute();
            assertNull(session(id).getSourceLeg().getEscrowId());

            harness.scheduler.advance(Duration.ofSeconds(1));
            assertEquals(2, harness.source.submissionAttempts.get());
            harness.scheduler.advance(Duration.ofSeconds(2));
            assertEquals(3, harness.source.submissionAttempts.get());

            SwapSession session = session(id);
            assertNotNull(session.getSourceLeg().getEscrowId());
            assertFalse(session.isDegraded());
            printSuccess("Escrow id recorded after retries");
        }

        @Test
        @DisplayName("6.2 Exhausted retries flag the session degraded without cancelling it")
        void exhaustedRetriesDegrade() {
            printTestHeader("Retry budget exhausted");

            harness.source.failNextSubmissions(10);
            UUID id = harness.openAndExecute();
            harness.scheduler.advance(Duration.ofSeconds(30));

            SwapSession session = session(id);
            printOutput("Session", session);
            assertEquals(4, harness.source.submissionAttempts.get());
            assertTrue(session.isDegraded());
            assertEquals("create_lock_exhausted", session.getDegradedReason());
            assertEquals(SwapStatus.SOURCE_LOCKING, session.getStatus());
            assertEquals(LegState.SUBMITTED, session.getSourceLeg().getState());
            printSuccess("Degraded, still waiting for the timeout");
        }

        @Test
        @DisplayName("6.3 A rejected lock abandons the leg and the timeout cancels cleanly")
        void rejectedLock() {
            harness.source.rejectNextSubmission("insufficient allowance");
            UUID id = harness.openAndExecute();

            SwapSession session = session(id);
            assertTrue(session.isDegraded());
            assertEquals("create_lock_rejected", session.getDegradedReason());
            assertEquals(LegState.ABANDONED, session.getSourceLeg().getState());

            harness.scheduler.advance(Duration.ofMinutes(14));
            assertEquals(SwapStatus.CANCELLED, session(id).getStatus());
        }

        @Test
        @DisplayName("6.4 A failure on one session leaves another untouched")
        void failuresAreIsolated() {
            printTestHeader("Session isolation");

            harness.source.rejectNextSubmission("bad request");
            UUID failing = harness.openAndExecute();
            UUID healthy = harness.toBothLocked();

            assertTrue(session(failing).isDegraded());
            assertFalse(session(healthy).isDegraded());
            assertEquals(SwapStatus.BOTH_LOCKED, session(healthy).getStatus());
            printSuccess("Healthy session reached both_locked");
        }

        @Test
        @DisplayName("6.5 A withdrawal keeps being retried past the retry budget")
        void withdrawalOutlivesRetryBudget() {
            printTestHeader("Destination gateway down for most of a minute");

            UUID id = harness.toBothLocked();
            harness.destination.failNextSubmissions(10);
            String secret = harness.disclose(id);

            harness.scheduler.advance(Duration.ofSeconds(30));
            SwapSession degraded = session(id);
            assertTrue(degraded.isDegraded());
            assertEquals("withdraw_exhausted", degraded.getDegradedReason());
            assertEquals(SwapStatus.REVEALING_SECRET, degraded.getStatus());
            assertTrue(harness.destination.withdrawals.isEmpty());

            harness.scheduler.advance(Duration.ofMinutes(1));
            printOutput("Withdrawals", harness.destination.withdrawals);
            assertEquals(List.of(degraded.getDestinationLeg().getEscrowId()), harness.destination.withdrawals);

            harness.confirmWithdraw(id, ChainRole.DESTINATION, secret);
            assertEquals(SwapStatus.COMPLETED, session(id).getStatus());
            printSuccess("Withdrawal accepted on the eleventh attempt");
        }

        @Test
        @DisplayName("6.6 Withdrawal retries end at the destination timelock")
        void withdrawalRetriesEndAtDeadline() {
            UUID id = harness.toBothLocked();
            Instant destinationDeadline = session(id).getDestinationLeg().getCancellationDeadline();
            harness.destination.failNextSubmissions(1000);
            harness.disclose(id);

            harness.scheduler.advanceTo(destinationDeadline.plus(Duration.ofMinutes(1)));

            assertTrue(harness.destination.withdrawals.isEmpty());
            assertEquals(0, harness.scheduler.pendingCount(), "No retry left scheduled");
            assertEquals(SwapStatus.REVEALING_SECRET, session(id).getStatus());
        }
    }

    @Nested
    @DisplayName("7. Step history")
    class StepHistory {

        @Test
        @DisplayName("7.1 Mainline steps complete strictly in order")
        void stepsInOrder() {
            UUID id = harness.toBothLocked();

            List<SwapStep> steps = session(id).getSteps();
            assertEquals(StepName.INITIALIZE, steps.get(0).getName());
            assertEquals(StepStatus.COMPLETED, steps.get(0).getStatus());
            assertEquals(StepStatus.COMPLETED, steps.get(1).getStatus());
            assertEquals(StepStatus.COMPLETED, steps.get(2).getStatus());
            assertEquals(StepStatus.WAITING, steps.get(3).getStatus());
            assertEquals(StepStatus.WAITING, steps.get(4).getStatus());
        }
    }
}
