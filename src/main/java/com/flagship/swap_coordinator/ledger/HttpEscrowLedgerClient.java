package com.flagship.swap_coordinator.ledger;

import com.flagship.swap_coordinator.session.ChainRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link EscrowLedgerClient} talking to a per-chain ledger gateway over HTTP
 * with Spring's {@link RestClient}.
 *
 * Gateway contract:
 * <pre>
 * POST /locks                  LockRequest          -> {"escrowId": "..."}
 * POST /locks/{id}/withdraw    {"secret": "0x.."}   -> 2xx
 * POST /locks/{id}/refund                           -> 2xx
 * GET  /head                                        -> {"height": n}
 * GET  /events?from=a&amp;to=b                          -> [RawEscrowEvent]
 * </pre>
 *
 * Submissions run on a dedicated I/O executor so no session worker ever
 * waits on the network. 4xx responses (other than 429) become
 * {@link LedgerRequestRejectedException}; everything else that fails is
 * {@link TransientLedgerException}.
 */
@Slf4j
public class HttpEscrowLedgerClient implements EscrowLedgerClient {

    private static final ParameterizedTypeReference<List<RawEscrowEvent>> EVENT_LIST =
            new ParameterizedTypeReference<>() { };

    private final ChainRole role;
    private final String chainId;
    private final RestClient restClient;
    private final Executor ioExecutor;

    public HttpEscrowLedgerClient(ChainRole role, String chainId, RestClient restClient, Executor ioExecutor) {
        this.role = Objects.requireNonNull(role, "role");
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
    }

    @Override
    public ChainRole role() {
        return role;
    }

    @Override
    public String chainId() {
        return chainId;
    }

    @Override
    public CompletableFuture<String> createLock(LockRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            LockCreated created = call("createLock", () -> restClient.post()
                    .uri("/locks")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(LockCreated.class));
            if (created == null || created.escrowId() == null || created.escrowId().isBlank()) {
                throw new TransientLedgerException(chainId + " gateway accepted lock without an escrow id");
            }
            log.info("Lock submitted on {}: session={}, escrowId={}", chainId, request.getSessionId(), created.escrowId());
            return created.escrowId();
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> withdraw(String escrowId, String secret) {
        return CompletableFuture.runAsync(() -> {
            call("withdraw", () -> restClient.post()
                    .uri("/locks/{escrowId}/withdraw", escrowId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("secret", secret))
                    .retrieve()
                    .toBodilessEntity());
            log.info("Withdrawal submitted on {}: escrowId={}", chainId, escrowId);
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> refund(String escrowId) {
        return CompletableFuture.runAsync(() -> {
            call("refund", () -> restClient.post()
                    .uri("/locks/{escrowId}/refund", escrowId)
                    .retrieve()
                    .toBodilessEntity());
            log.info("Refund submitted on {}: escrowId={}", chainId, escrowId);
        }, ioExecutor);
    }

    @Override
    public long headHeight() {
        Head head = call("head", () -> restClient.get()
                .uri("/head")
                .retrieve()
                .body(Head.class));
        if (head == null) {
            throw new TransientLedgerException(chainId + " gateway returned an empty head");
        }
        return head.height();
    }

    @Override
    public List<RawEscrowEvent> fetchEvents(long fromExclusive, long toInclusive) {
        List<RawEscrowEvent> events = call("events", () -> restClient.get()
                .uri(uri -> uri.path("/events")
                        .queryParam("from", fromExclusive)
                        .queryParam("to", toInclusive)
                        .build())
                .retrieve()
                .body(EVENT_LIST));
        return events != null ? events : List.of();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientLedgerException(chainId + " " + operation + " throttled", e);
            }
            throw new LedgerRequestRejectedException(
                    chainId + " " + operation + " rejected: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new TransientLedgerException(chainId + " " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private record LockCreated(String escrowId) { }

    private record Head(long height) { }
}
