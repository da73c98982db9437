package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.coordinator.CrossChainCoordinator;
import com.flagship.swap_coordinator.observability.CorrelationContext;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import com.flagship.swap_coordinator.session.dto.CreateSessionRequest;
import com.flagship.swap_coordinator.session.dto.ExecuteSwapRequest;
import com.flagship.swap_coordinator.session.dto.SecretRequest;
import com.flagship.swap_coordinator.session.dto.SecretResponse;
import com.flagship.swap_coordinator.session.dto.SessionListResponse;
import com.flagship.swap_coordinator.session.dto.SessionResponse;
import com.flagship.swap_coordinator.session.dto.SessionStatusResponse;
import com.flagship.swap_coordinator.session.dto.SwapActionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for swap sessions.
 *
 * A thin layer: creation, execution, cancellation and secret requests go
 * to the {@link CrossChainCoordinator}, reads go to the {@link SessionStore}.
 *
 * Key features:
 * - Session creation requires an Idempotency-Key header
 * - Repeating a creation with the same key returns the original session
 * - Execute and cancel answer once the status is written, not once the
 *   ledgers confirm anything
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int MAX_PAGE_SIZE = 200;

    private final CrossChainCoordinator coordinator;
    private final SessionStore sessionStore;
    private final IdempotencyService idempotencyService;
    private final SwapMetrics swapMetrics;
    private final Clock clock;

    /**
     * Opens a new swap session.
     *
     * @return 201 with the new session, or 200 with the session created
     *         earlier under the same Idempotency-Key
     */
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(
            @Valid @RequestBody CreateSessionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        log.info("Received session creation request: idempotencyKey={}, {} -> {}",
                idempotencyKey, request.getSourceChain(), request.getDestinationChain());

        try {
            Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
            if (existingId.isPresent()) {
                swapMetrics.recordIdempotencyHit();
                MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, existingId.get().toString());
                log.info("Idempotency key already used, returning existing session");
                return ResponseEntity.ok(SessionResponse.from(sessionStore.get(existingId.get())));
            }
            swapMetrics.recordIdempotencyMiss();

            SwapSession session;
            try {
                session = coordinator.openSession(request.toParams(), idempotencyKey);
            } catch (DataIntegrityViolationException e) {
                // a concurrent request with the same key won the insert
                UUID winner = sessionStore.findIdByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
                log.info("Concurrent creation with idempotency key {}, returning session {}", idempotencyKey, winner);
                return ResponseEntity.ok(SessionResponse.from(sessionStore.get(winner)));
            }

            MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.getSessionId().toString());
            idempotencyService.storeIdempotencyKey(idempotencyKey, session.getSessionId());

            long duration = System.currentTimeMillis() - startTime;
            swapMetrics.recordApiLatency("create", duration);
            log.info("Session created successfully: duration={}ms", duration);

            return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            swapMetrics.recordApiLatency("create", duration);
            log.warn("Session creation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionStatusResponse> getSession(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SessionStatusResponse.from(sessionStore.get(id), clock.instant()));
    }

    /**
     * Lists sessions, newest first.
     *
     * @param status optional comma-separated status filter, e.g. {@code both_locked,revealing_secret}
     */
    @GetMapping
    public ResponseEntity<SessionListResponse> listSessions(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "maker", required = false) String maker,
            @RequestParam(value = "taker", required = false) String taker,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {

        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }

        SessionFilter filter = SessionFilter.builder()
                .statuses(parseStatuses(status))
                .maker(maker)
                .taker(taker)
                .limit(limit)
                .offset(offset)
                .build();

        List<SessionStatusResponse> sessions = sessionStore.list(filter).stream()
                .map(session -> SessionStatusResponse.from(session, clock.instant()))
                .toList();
        return ResponseEntity.ok(new SessionListResponse(sessions, sessions.size(), limit, offset));
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<SwapActionResponse> executeSwap(@PathVariable("id") UUID id,
                                                          @Valid @RequestBody ExecuteSwapRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, id.toString());
        try {
            SwapSession session = coordinator.executeSwap(id, request.toAuthorization());
            log.info("Swap execution started, confirmation level {}",
                    request.getConfirmationLevel() != null ? request.getConfirmationLevel() : "secure");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SwapActionResponse.builder()
                    .sessionId(id)
                    .status(session.getStatus())
                    .message("Swap execution started")
                    .trackingUrl("/api/sessions/" + id)
                    .build());
        } finally {
            swapMetrics.recordApiLatency("execute", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<SwapActionResponse> cancelSwap(@PathVariable("id") UUID id) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, id.toString());
        try {
            SwapSession session = coordinator.cancelSwap(id);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SwapActionResponse.builder()
                    .sessionId(id)
                    .status(session.getStatus())
                    .message("Cancellation started")
                    .refundAddress(session.getMaker())
                    .build());
        } finally {
            swapMetrics.recordApiLatency("cancel", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    /**
     * Hands the secret to the session's taker once both escrows are locked.
     */
    @PostMapping("/{id}/secret")
    public ResponseEntity<SecretResponse> requestSecret(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody SecretRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            String secret = coordinator.discloseSecret(id, request.getRequester());
            return ResponseEntity.ok(new SecretResponse(id, secret, sessionStore.get(id).getHashlock()));
        } finally {
            swapMetrics.recordApiLatency("secret", System.currentTimeMillis() - startTime);
        }
    }

    private static Set<SwapStatus> parseStatuses(String status) {
        if (status == null || status.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(status.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(SwapStatus::fromWireName)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(SwapStatus.class)));
    }
}
