package com.flagship.swap_coordinator.coordinator;

import com.flagship.swap_coordinator.exception.InvalidStateException;
import com.flagship.swap_coordinator.exception.UnauthorizedExecutionException;
import com.flagship.swap_coordinator.ledger.EscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.EscrowLedgers;
import com.flagship.swap_coordinator.ledger.LedgerRequestRejectedException;
import com.flagship.swap_coordinator.ledger.LockRequest;
import com.flagship.swap_coordinator.ledger.RetryBackoff;
import com.flagship.swap_coordinator.notification.NotificationBus;
import com.flagship.swap_coordinator.notification.SessionNotification;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import com.flagship.swap_coordinator.observer.LedgerEvent;
import com.flagship.swap_coordinator.observer.LedgerEventListener;
import com.flagship.swap_coordinator.secret.SecretManager;
import com.flagship.swap_coordinator.session.ChainRole;
import com.flagship.swap_coordinator.session.CreateSessionParams;
import com.flagship.swap_coordinator.session.EscrowLeg;
import com.flagship.swap_coordinator.session.LegState;
import com.flagship.swap_coordinator.session.SessionStore;
import com.flagship.swap_coordinator.session.StepName;
import com.flagship.swap_coordinator.session.StepStatus;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Drives every swap session through its state machine.
 *
 * Inputs are confirmed ledger events ({@link #onLedgerEvent}), secret
 * requests ({@link #discloseSecret}), deadline ticks ({@link #onDeadline})
 * and the execute/cancel requests of the API. Each of them is turned into a
 * task in the session's mailbox, so everything that reads and writes one
 * session runs strictly one after another.
 *
 * Rules:
 * - A status only ever moves along one edge of {@link SwapStatus}; events
 *   that do not fit the current status and leg state are ignored
 * - Ledger submissions are fire-and-forget; their outcome comes back as a
 *   new mailbox task, and confirmation only ever comes from the observers
 * - Before both escrows are locked a timer drives cancellation on its own
 * - Refunds go destination first, source only once the destination side
 *   holds nothing of the taker's; no refund is requested before the
 *   escrow's own timelock has run out
 * - A failed submission never cancels a swap; it flags the session degraded.
 *   Withdrawals and refunds keep being retried while they still matter
 */
@Service
@Slf4j
public class CrossChainCoordinator implements LedgerEventListener {

    private static final List<ChainRole> REFUND_ORDER = List.of(ChainRole.DESTINATION, ChainRole.SOURCE);

    private final SessionStore store;
    private final SecretManager secretManager;
    private final EscrowLedgers ledgers;
    private final SessionWorkers workers;
    private final SessionTimers timers;
    private final TaskScheduler scheduler;
    private final TimelockPolicy timelocks;
    private final RetryBackoff backoff;
    private final NotificationBus notifications;
    private final SwapMetrics metrics;
    private final Clock clock;

    public CrossChainCoordinator(SessionStore store, SecretManager secretManager, EscrowLedgers ledgers,
                                 SessionWorkers workers, SessionTimers timers, TaskScheduler scheduler,
                                 TimelockPolicy timelocks, RetryBackoff backoff, NotificationBus notifications,
                                 SwapMetrics metrics, Clock clock) {
        this.store = store;
        this.secretManager = secretManager;
        this.ledgers = ledgers;
        this.workers = workers;
        this.timers = timers;
        this.scheduler = scheduler;
        this.timelocks = timelocks;
        this.backoff = backoff;
        this.notifications = notifications;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------------

    /**
     * Creates a session and arms its expiration timer.
     */
    public SwapSession openSession(CreateSessionParams params, String idempotencyKey) {
        SwapSession session;
        try {
            session = store.create(UUID.randomUUID(), params, idempotencyKey);
        } catch (RuntimeException e) {
            metrics.recordSessionCreated(params.getSourceChain(), params.getDestinationChain(), "rejected");
            throw e;
        }
        metrics.recordSessionCreated(session.getSourceChain(), session.getDestinationChain(), "success");
        rearm(session);
        publish(session);
        return session;
    }

    /**
     * Starts the swap. Returns once the session is {@code executing}; the
     * source lock is requested afterwards in the session's mailbox.
     *
     * @throws UnauthorizedExecutionException authorization not from the maker
     * @throws InvalidStateException session is not {@code initialized}
     */
    public SwapSession executeSwap(UUID sessionId, SwapAuthorization authorization) {
        SwapSession session = store.get(sessionId);
        if (authorization == null || authorization.getSigner() == null) {
            throw new UnauthorizedExecutionException(sessionId, "missing authorization");
        }
        if (!authorization.getSigner().equals(session.getMaker())) {
            log.warn("Rejected execution of session {}: signer is not the maker", sessionId);
            throw new UnauthorizedExecutionException(sessionId, "signer is not the maker");
        }
        if (authorization.getSignature() == null || authorization.getSignature().isBlank()) {
            throw new UnauthorizedExecutionException(sessionId, "missing signature");
        }

        SwapSession executing = await(workers.call(sessionId,
                () -> advance(store.get(sessionId), SwapStatus.EXECUTING, UnaryOperator.identity())));
        workers.submit(sessionId, () -> requestSourceLock(sessionId, authorization.getSignature()));
        return executing;
    }

    /**
     * Moves a session that has not reached {@code both_locked} into
     * cancellation and requests refunds for whatever is locked. Cancelling
     * twice is a no-op.
     *
     * @throws InvalidStateException session is past the point of cancellation
     */
    public SwapSession cancelSwap(UUID sessionId) {
        return await(workers.call(sessionId, () -> {
            SwapSession session = store.get(sessionId);
            if (session.getStatus() == SwapStatus.CANCELLING) {
                return session;
            }
            if (!session.getStatus().isCancellable()) {
                throw new InvalidStateException(session.getStatus(), String.format(
                        "Session %s cannot be cancelled in %s status", sessionId, session.getStatus().wireName()));
            }
            return beginCancellation(session, "requested");
        }));
    }

    @Override
    public void onLedgerEvent(LedgerEvent event) {
        Optional<SwapSession> match = Optional.empty();
        if (event.getHashlock() != null) {
            match = store.findByHashlock(event.getHashlock());
        }
        if (match.isEmpty() && event.getEscrowId() != null) {
            match = store.findByEscrowId(event.getEscrowId());
        }
        if (match.isEmpty()) {
            log.debug("No session for {} event {} on {}", event.getType(), event.getEventId(), event.getChainId());
            metrics.recordLedgerEvent(event.getRole().name(), event.getType().name(), "unmatched");
            return;
        }

        SwapSession session = match.get();
        if (!Objects.equals(session.chainId(event.getRole()), event.getChainId())) {
            log.warn("Event {} from {} does not belong to the {} side of session {}",
                    event.getEventId(), event.getChainId(), event.getRole(), session.getSessionId());
            metrics.recordLedgerEvent(event.getRole().name(), event.getType().name(), "chain_mismatch");
            return;
        }
        UUID sessionId = session.getSessionId();
        workers.submit(sessionId, () -> handleLedgerEvent(sessionId, event));
    }

    /**
     * Hands the secret to the taker and, on the first disclosure, moves the
     * session to {@code revealing_secret} and requests the maker's
     * withdrawal. Both happen in one mailbox task: a deadline that is already
     * queued either runs first, and the request is refused, or runs after
     * the session has left {@code both_locked}.
     *
     * @see SecretManager#discloseSecret
     */
    public String discloseSecret(UUID sessionId, String requester) {
        return await(workers.call(sessionId, () -> {
            String secret = secretManager.discloseSecret(sessionId, requester);
            startReveal(sessionId, secret);
            return secret;
        }));
    }

    public void onDeadline(UUID sessionId) {
        workers.submit(sessionId, () -> handleDeadline(sessionId));
    }

    /**
     * Restores the in-memory side of a session after a restart: its timer,
     * pending refunds and a reveal that was in flight.
     */
    public void recover(UUID sessionId) {
        workers.submit(sessionId, () -> {
            SwapSession session = store.get(sessionId);
            if (session.getStatus() == SwapStatus.COMPLETED) {
                return;
            }
            log.info("Recovering session {} in {} status", sessionId, session.getStatus().wireName());
            switch (session.getStatus()) {
                case CANCELLING, CANCELLED, EXPIRED -> {
                    for (ChainRole role : REFUND_ORDER) {
                        if (session.leg(role).isIn(LegState.REFUND_REQUESTED)) {
                            requestRefund(session, role);
                        }
                    }
                    session = advanceRefunds(session);
                }
                case REVEALING_SECRET -> {
                    if (session.getDestinationLeg().isIn(LegState.LOCKED) && session.hasSecret()) {
                        requestWithdrawal(session);
                    }
                }
                default -> { }
            }
            rearm(session);
        });
    }

    // ---------------------------------------------------------------------
    // Forward path
    // ---------------------------------------------------------------------

    private void requestSourceLock(UUID sessionId, String authorizationSignature) {
        SwapSession session = store.get(sessionId);
        if (session.getStatus() != SwapStatus.EXECUTING) {
            log.info("Skipping source lock of session {}: now {}", sessionId, session.getStatus().wireName());
            return;
        }
        Instant now = clock.instant();
        Instant deadline = timelocks.sourceDeadline(now);
        session = advance(session, SwapStatus.SOURCE_LOCKING,
                s -> s.withLeg(s.getSourceLeg().submitted(deadline, now), now));
        submitLock(session, ChainRole.SOURCE, deadline, authorizationSignature);
    }

    private void requestDestinationLock(SwapSession session) {
        Instant now = clock.instant();
        Instant deadline = timelocks.destinationDeadline(now, session.getSourceLeg().getCancellationDeadline());
        if (!deadline.isAfter(now)) {
            log.warn("Session {} has no time left for the destination lock", session.getSessionId());
            beginCancellation(session, "timeout");
            return;
        }
        session = advance(session, SwapStatus.DESTINATION_LOCKING,
                s -> s.withLeg(s.getDestinationLeg().submitted(deadline, now), now));
        submitLock(session, ChainRole.DESTINATION, deadline, null);
    }

    private void submitLock(SwapSession session, ChainRole role, Instant deadline, String authorizationSignature) {
        LockRequest request = LockRequest.builder()
                .sessionId(session.getSessionId())
                .hashlock(session.getHashlock())
                .depositor(session.expectedDepositor(role))
                .beneficiary(session.expectedDepositor(role.counterpart()))
                .token(role == ChainRole.SOURCE ? session.getSourceToken() : session.getDestinationToken())
                .amount(session.expectedAmount(role))
                .cancellationDeadline(deadline)
                .authorizationSignature(authorizationSignature)
                .build();
        SwapStatus lockingStatus = role == ChainRole.SOURCE ? SwapStatus.SOURCE_LOCKING : SwapStatus.DESTINATION_LOCKING;
        EscrowLedgerClient ledger = ledgers.forRole(role);

        submitWithRetry(session.getSessionId(), new LedgerCall<>(
                role,
                "create_lock",
                () -> ledger.createLock(request),
                s -> s.getStatus() == lockingStatus
                        && s.leg(role).isIn(LegState.SUBMITTED)
                        && s.leg(role).getEscrowId() == null,
                false,
                (s, escrowId) -> {
                    EscrowLeg leg = s.leg(role);
                    if (leg.isIn(LegState.SUBMITTED) && leg.getEscrowId() == null) {
                        store.update(s.getSessionId(), current -> current.withLeg(leg.withEscrowId(escrowId), clock.instant()));
                    }
                },
                (s, cause) -> {
                    if (cause instanceof LedgerRequestRejectedException && s.leg(role).isIn(LegState.SUBMITTED)) {
                        // nothing was locked; the leg can be treated as settled
                        SwapSession abandoned = store.update(s.getSessionId(),
                                current -> current.withLeg(current.leg(role).withState(LegState.ABANDONED), clock.instant()));
                        if (abandoned.getStatus() == SwapStatus.CANCELLING) {
                            advanceRefunds(abandoned);
                        }
                    }
                }));
    }

    private void startReveal(UUID sessionId, String secret) {
        SwapSession session = store.get(sessionId);
        if (session.getStatus() != SwapStatus.BOTH_LOCKED) {
            log.debug("Ignoring disclosure for session {} in {} status", sessionId, session.getStatus().wireName());
            return;
        }
        Instant now = clock.instant();
        session = advance(session, SwapStatus.REVEALING_SECRET, s -> s.withSecret(secret, now));
        requestWithdrawal(session);
    }

    /**
     * The taker holds the secret from here on, so the maker's withdrawal is
     * retried for as long as the destination escrow can still be withdrawn.
     */
    private void requestWithdrawal(SwapSession session) {
        String escrowId = session.getDestinationLeg().getEscrowId();
        String secret = session.getSecret();
        Instant withdrawableUntil = session.getDestinationLeg().getCancellationDeadline();
        EscrowLedgerClient ledger = ledgers.forRole(ChainRole.DESTINATION);
        submitWithRetry(session.getSessionId(), new LedgerCall<>(
                ChainRole.DESTINATION,
                "withdraw",
                () -> ledger.withdraw(escrowId, secret),
                s -> s.getStatus() == SwapStatus.REVEALING_SECRET
                        && s.getDestinationLeg().isIn(LegState.LOCKED)
                        && (withdrawableUntil == null || clock.instant().isBefore(withdrawableUntil)),
                true,
                (s, ignored) -> log.info("Withdrawal of session {} accepted by {}", s.getSessionId(), ledger.chainId()),
                (s, cause) -> { }));
    }

    // ---------------------------------------------------------------------
    // Ledger events
    // ---------------------------------------------------------------------

    private void handleLedgerEvent(UUID sessionId, LedgerEvent event) {
        SwapSession session = store.get(sessionId);
        String outcome = switch (event.getType()) {
            case LOCK_CONFIRMED -> onLockConfirmed(session, event);
            case WITHDRAW_CONFIRMED -> onWithdrawConfirmed(session, event);
            case REFUND_CONFIRMED -> onRefundConfirmed(session, event);
        };
        metrics.recordLedgerEvent(event.getRole().name(), event.getType().name(), outcome);
        log.debug("{} {} for session {}: {}", event.getRole(), event.getType(), sessionId, outcome);
    }

    private String onLockConfirmed(SwapSession session, LedgerEvent event) {
        ChainRole role = event.getRole();
        EscrowLeg leg = session.leg(role);
        if (leg.isIn(LegState.LOCKED) || leg.isIn(LegState.REFUND_REQUESTED)
                || leg.isIn(LegState.REFUNDED) || leg.isIn(LegState.WITHDRAWN)) {
            return "duplicate";
        }
        if (leg.getEscrowId() != null && event.getEscrowId() != null && !leg.getEscrowId().equals(event.getEscrowId())) {
            log.warn("Session {}: {} lock {} is not the escrow we requested ({})",
                    session.getSessionId(), role, event.getEscrowId(), leg.getEscrowId());
            return "rejected";
        }
        if (!Objects.equals(event.getParty(), session.expectedDepositor(role))) {
            log.warn("Session {}: {} lock funded by an unexpected party", session.getSessionId(), role);
            return "rejected";
        }
        if (event.getAmount() == null || event.getAmount().compareTo(session.expectedAmount(role)) < 0) {
            log.warn("Session {}: {} lock of {} is below the expected {}",
                    session.getSessionId(), role, event.getAmount(), session.expectedAmount(role));
            return "rejected";
        }

        Instant now = clock.instant();
        EscrowLeg locked = leg.locked(event.getEscrowId(), event.getAmount(), event.getCancellationDeadline());
        SwapStatus status = session.getStatus();

        if (role == ChainRole.SOURCE && status == SwapStatus.SOURCE_LOCKING) {
            SwapSession sourceLocked = advance(session, SwapStatus.SOURCE_LOCKED, s -> s.withLeg(locked, now));
            requestDestinationLock(sourceLocked);
            return "applied";
        }
        if (role == ChainRole.DESTINATION && status == SwapStatus.DESTINATION_LOCKING) {
            advance(session, SwapStatus.BOTH_LOCKED, s -> s.withLeg(locked, now));
            return "applied";
        }
        if (status == SwapStatus.CANCELLING || status == SwapStatus.CANCELLED || status == SwapStatus.EXPIRED) {
            if (status != SwapStatus.CANCELLING) {
                log.warn("Late {} lock on session {} after it became {}; requesting refund",
                        role, session.getSessionId(), status.wireName());
            }
            SwapSession recorded = store.update(session.getSessionId(), s -> s.withLeg(locked, now));
            advanceRefunds(recorded);
            return "refunding";
        }
        return "ignored";
    }

    private String onWithdrawConfirmed(SwapSession session, LedgerEvent event) {
        ChainRole role = event.getRole();
        EscrowLeg leg = session.leg(role);
        if (leg.isIn(LegState.WITHDRAWN)) {
            return "duplicate";
        }
        if (!matchesEscrow(leg, event)) {
            return "ignored";
        }
        if (!secretManager.verify(event.getSecret(), session.getHashlock())) {
            log.warn("Session {}: {} withdrawal carries a secret that does not open the hashlock",
                    session.getSessionId(), role);
            return "rejected";
        }

        Instant now = clock.instant();
        if (role == ChainRole.DESTINATION) {
            if (session.getStatus() == SwapStatus.BOTH_LOCKED) {
                // revealed outside the coordinator; catch up one edge at a time
                session = advance(session, SwapStatus.REVEALING_SECRET, s -> s.withSecret(event.getSecret(), now));
            }
            if (session.getStatus() == SwapStatus.REVEALING_SECRET) {
                advance(session, SwapStatus.COMPLETED,
                        s -> s.withLeg(s.getDestinationLeg().withState(LegState.WITHDRAWN), now));
                log.info("Session {} completed", session.getSessionId());
                return "applied";
            }
        }
        store.update(session.getSessionId(), s -> s.withLeg(s.leg(role).withState(LegState.WITHDRAWN), now));
        return "recorded";
    }

    private String onRefundConfirmed(SwapSession session, LedgerEvent event) {
        ChainRole role = event.getRole();
        EscrowLeg leg = session.leg(role);
        if (leg.isIn(LegState.REFUNDED)) {
            return "duplicate";
        }
        if (leg.isIn(LegState.NONE) || leg.isIn(LegState.WITHDRAWN) || !matchesEscrow(leg, event)) {
            return "ignored";
        }

        Instant now = clock.instant();
        SwapSession refunded = store.update(session.getSessionId(),
                s -> s.withLeg(s.leg(role).withState(LegState.REFUNDED), now));
        switch (refunded.getStatus()) {
            case CANCELLING, CANCELLED, EXPIRED -> advanceRefunds(refunded);
            default -> {
                log.warn("Session {}: {} escrow refunded while {}", refunded.getSessionId(), role,
                        refunded.getStatus().wireName());
                degrade(refunded, role.name().toLowerCase() + "_refunded_early");
            }
        }
        return "applied";
    }

    private static boolean matchesEscrow(EscrowLeg leg, LedgerEvent event) {
        return leg.getEscrowId() == null || event.getEscrowId() == null || leg.getEscrowId().equals(event.getEscrowId());
    }

    // ---------------------------------------------------------------------
    // Cancellation, expiry and refunds
    // ---------------------------------------------------------------------

    private void handleDeadline(UUID sessionId) {
        SwapSession session = store.get(sessionId);
        Optional<Instant> due = nextDeadline(session);
        if (due.isEmpty()) {
            timers.cancel(sessionId);
            return;
        }
        Instant now = clock.instant();
        if (now.isBefore(due.get())) {
            // fired early; the running timer must not count as armed
            timers.cancel(sessionId);
            rearm(session);
            return;
        }

        SwapStatus status = session.getStatus();
        if (status.isCancellable()) {
            log.warn("Session {} timed out in {} status; cancelling", sessionId, status.wireName());
            beginCancellation(session, "timeout");
        } else if (status == SwapStatus.BOTH_LOCKED) {
            log.warn("Session {} expired before the secret was disclosed; refunding", sessionId);
            SwapSession expired = advance(session, SwapStatus.EXPIRED, s -> s.withCancellationReason("expired"));
            advanceRefunds(expired);
        } else {
            advanceRefunds(session);
        }
    }

    private SwapSession beginCancellation(SwapSession session, String reason) {
        SwapSession cancelling = advance(session, SwapStatus.CANCELLING, s -> s.withCancellationReason(reason));
        log.info("Cancelling session {} ({})", cancelling.getSessionId(), reason);
        return advanceRefunds(cancelling);
    }

    /**
     * Takes the next step of the refund sequence, destination first.
     *
     * A locked leg waits for its cancellation deadline, then gets a refund
     * request and the sequence waits for its confirmation. A submitted leg
     * waits for its own deadline and is then abandoned. Once every leg is
     * settled a cancelling session becomes {@code cancelled} and an expired
     * one gets its refund step completed.
     */
    private SwapSession advanceRefunds(SwapSession session) {
        UUID sessionId = session.getSessionId();
        Instant now = clock.instant();

        for (ChainRole role : REFUND_ORDER) {
            EscrowLeg leg = session.leg(role);
            switch (leg.getState()) {
                case LOCKED -> {
                    Instant refundableAt = leg.getCancellationDeadline();
                    if (refundableAt != null && now.isBefore(refundableAt)) {
                        log.debug("Session {}: {} escrow refundable at {}", sessionId, role, refundableAt);
                        rearm(session);
                        return session;
                    }
                    SwapSession requested = store.update(sessionId,
                            s -> s.withLeg(s.leg(role).withState(LegState.REFUND_REQUESTED), now));
                    requestRefund(requested, role);
                    rearm(requested);
                    return requested;
                }
                case REFUND_REQUESTED -> {
                    rearm(session);
                    return session;
                }
                case SUBMITTED -> {
                    Instant deadline = leg.getCancellationDeadline();
                    if (deadline != null && now.isBefore(deadline)) {
                        rearm(session);
                        return session;
                    }
                    log.info("Session {}: {} lock never confirmed before {}; abandoning it", sessionId, role, deadline);
                    session = store.update(sessionId, s -> s.withLeg(s.leg(role).withState(LegState.ABANDONED), now));
                }
                default -> { }
            }
        }

        if (session.getStatus() == SwapStatus.CANCELLING) {
            session = advance(session, SwapStatus.CANCELLED, UnaryOperator.identity());
            log.info("Session {} cancelled", sessionId);
        } else if (session.getStatus() == SwapStatus.EXPIRED
                && session.stepStatus(StepName.REFUND) != StepStatus.COMPLETED) {
            session = store.update(sessionId, s -> s.withStep(StepName.REFUND, StepStatus.COMPLETED, now));
            log.info("Session {} fully refunded after expiry", sessionId);
        }
        rearm(session);
        return session;
    }

    /**
     * Retried until the ledger accepts it. A rejection is not final: a
     * ledger whose clock lags ours refuses a refund that is due.
     */
    private void requestRefund(SwapSession session, ChainRole role) {
        String escrowId = session.leg(role).getEscrowId();
        EscrowLedgerClient ledger = ledgers.forRole(role);
        log.info("Requesting {} refund of escrow {} for session {}", role, escrowId, session.getSessionId());
        submitWithRetry(session.getSessionId(), new LedgerCall<>(
                role,
                "refund",
                () -> ledger.refund(escrowId),
                s -> s.leg(role).isIn(LegState.REFUND_REQUESTED),
                true,
                (s, ignored) -> log.debug("Refund of {} escrow {} accepted", role, escrowId),
                (s, cause) -> { }));
    }

    // ---------------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------------

    /**
     * Single edge, then the side effects every transition has: metrics,
     * notification and timer.
     */
    private SwapSession advance(SwapSession session, SwapStatus next, UnaryOperator<SwapSession> alongside) {
        SwapStatus from = session.getStatus();
        SwapSession moved = store.transition(session.getSessionId(), next, alongside);
        metrics.recordTransition(from.wireName(), next.wireName());
        publish(moved);
        rearm(moved);
        return moved;
    }

    private void publish(SwapSession session) {
        notifications.publish(SessionNotification.of(session, clock.instant()));
    }

    private void degrade(SwapSession session, String reason) {
        store.update(session.getSessionId(), s -> s.markDegraded(reason, clock.instant()));
        metrics.recordSessionDegraded(reason);
    }

    private void rearm(SwapSession session) {
        UUID sessionId = session.getSessionId();
        Optional<Instant> due = nextDeadline(session);
        if (due.isPresent()) {
            timers.arm(sessionId, due.get(), () -> onDeadline(sessionId));
        } else {
            timers.cancel(sessionId);
        }
    }

    /**
     * When the coordinator must act on its own next:
     * - before both sides are locked: expiry, or one margin before the source
     *   escrow becomes refundable, whichever is first
     * - both locked: expiry, or one margin before the destination escrow
     *   becomes refundable
     * - cancelling, cancelled or expired: the deadline of the next leg in
     *   refund order that is waiting on the clock
     * - otherwise never
     */
    Optional<Instant> nextDeadline(SwapSession session) {
        Instant expiration = session.getExpirationTime();
        return switch (session.getStatus()) {
            case INITIALIZED, EXECUTING, SOURCE_LOCKING, SOURCE_LOCKED, DESTINATION_LOCKING ->
                    Optional.of(earliest(expiration, session.getSourceLeg().getCancellationDeadline()));
            case BOTH_LOCKED -> Optional.of(earliest(expiration, session.getDestinationLeg().getCancellationDeadline()));
            case CANCELLING, CANCELLED, EXPIRED -> nextRefundStep(session);
            case REVEALING_SECRET, COMPLETED -> Optional.empty();
        };
    }

    /**
     * A lock that never confirmed is abandoned at its deadline and a locked
     * escrow is refunded at its deadline. A leg with a refund in flight
     * holds the sequence without a timer; its retries drive it.
     */
    private static Optional<Instant> nextRefundStep(SwapSession session) {
        for (ChainRole role : REFUND_ORDER) {
            EscrowLeg leg = session.leg(role);
            switch (leg.getState()) {
                case SUBMITTED, LOCKED -> {
                    return Optional.ofNullable(leg.getCancellationDeadline());
                }
                case REFUND_REQUESTED -> {
                    return Optional.empty();
                }
                default -> { }
            }
        }
        return Optional.empty();
    }

    private Instant earliest(Instant expiration, Instant escrowDeadline) {
        if (escrowDeadline == null) {
            return expiration;
        }
        Instant actBy = timelocks.actBefore(escrowDeadline);
        return actBy.isBefore(expiration) ? actBy : expiration;
    }

    private <T> void submitWithRetry(UUID sessionId, LedgerCall<T> call) {
        attempt(sessionId, call, 1);
    }

    private <T> void attempt(UUID sessionId, LedgerCall<T> call, int attempt) {
        CompletableFuture<T> future;
        try {
            future = call.request().get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, error) ->
                workers.submit(sessionId, () -> afterAttempt(sessionId, call, attempt, result, error)));
    }

    private <T> void afterAttempt(UUID sessionId, LedgerCall<T> call, int attempt, T result, Throwable error) {
        SwapSession session = store.get(sessionId);
        String role = call.role().name();
        if (error == null) {
            metrics.recordLedgerSubmission(role, call.operation(), "success");
            call.onSuccess().accept(session, result);
            return;
        }

        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (!call.stillRelevant().test(session)) {
            log.info("Dropping failed {} {} for session {}: no longer relevant in {}",
                    role, call.operation(), sessionId, session.getStatus().wireName());
            metrics.recordLedgerSubmission(role, call.operation(), "dropped");
            return;
        }

        boolean rejected = cause instanceof LedgerRequestRejectedException;
        if (rejected || !backoff.hasAttemptsLeft(attempt)) {
            String outcome = rejected ? "rejected" : "exhausted";
            if (!call.untilIrrelevant()) {
                log.error("{} {} for session {} {} after {} attempt(s): {}",
                        role, call.operation(), sessionId, outcome, attempt, cause.getMessage());
                metrics.recordLedgerSubmission(role, call.operation(), outcome);
                degrade(session, call.operation() + "_" + outcome);
                call.onGiveUp().accept(store.get(sessionId), cause);
                return;
            }
            if (!session.isDegraded()) {
                log.error("{} {} for session {} {} after {} attempt(s), still retrying: {}",
                        role, call.operation(), sessionId, outcome, attempt, cause.getMessage());
                degrade(session, call.operation() + "_" + outcome);
            }
        }

        Duration delay = backoff.delayBefore(attempt + 1);
        log.warn("{} {} for session {} failed (attempt {}), retrying in {}: {}",
                role, call.operation(), sessionId, attempt, delay, cause.getMessage());
        metrics.recordLedgerSubmission(role, call.operation(), "retry");
        scheduler.schedule(() -> workers.submit(sessionId, () -> {
            if (call.stillRelevant().test(store.get(sessionId))) {
                attempt(sessionId, call, attempt + 1);
            }
        }), scheduler.getClock().instant().plus(delay));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * One ledger submission with what to do on each outcome. Every callback
     * runs in the session's mailbox. With {@code untilIrrelevant} the call
     * outlives the retry budget and rejections, and stops only once
     * {@code stillRelevant} turns false.
     */
    private record LedgerCall<T>(ChainRole role,
                                 String operation,
                                 Supplier<CompletableFuture<T>> request,
                                 Predicate<SwapSession> stillRelevant,
                                 boolean untilIrrelevant,
                                 BiConsumer<SwapSession, T> onSuccess,
                                 BiConsumer<SwapSession, Throwable> onGiveUp) {
    }
}
