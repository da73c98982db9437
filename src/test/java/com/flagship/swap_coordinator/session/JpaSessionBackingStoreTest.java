package com.flagship.swap_coordinator.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.swap_coordinator.outbox.OutboxEvent;
import com.flagship.swap_coordinator.outbox.OutboxEventRepository;
import com.flagship.swap_coordinator.outbox.OutboxService;
import com.flagship.swap_coordinator.secret.Hashlocks;
import com.flagship.swap_coordinator.secret.SealedSecretRepository;
import com.flagship.swap_coordinator.secret.SecretVault;
import com.flagship.swap_coordinator.session.event.SessionCreatedEvent;
import com.flagship.swap_coordinator.session.event.SessionStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session persistence against a real PostgreSQL: the row and its outbox
 * facts commit together, lookups by hashlock, escrow id and idempotency key
 * work, and the sealed secret never appears in clear in the database.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaSessionBackingStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("swap_coordinator_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("swap.observer.enabled", () -> "false");
        registry.add("swap.secrets.encryption-key", () -> "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=");
    }

    private static final String MAKER = "0x1111111111111111111111111111111111111111";
    private static final String TAKER = "taker.near";

    @Autowired
    private SessionStore sessionStore;

    @Autowired
    private SwapSessionRepository sessionRepository;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private SealedSecretRepository sealedSecretRepository;

    @Autowired
    private SecretVault secretVault;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        sealedSecretRepository.deleteAll();
        sessionRepository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static CreateSessionParams params(String maker) {
        return CreateSessionParams.builder()
                .sourceChain("base")
                .destinationChain("near")
                .sourceToken("0x2222222222222222222222222222222222222222")
                .destinationToken("usdc.near")
                .sourceAmount(new BigInteger("1000000000000000000"))
                .destinationAmount(new BigInteger("2500000"))
                .maker(maker)
                .taker(TAKER)
                .slippageToleranceBps(50)
                .build();
    }

    @Test
    @DisplayName("Created session round-trips with steps, legs and fees")
    void createAndReload() {
        printTestHeader("Create and reload");

        SwapSession created = sessionStore.create(UUID.randomUUID(), params(MAKER), "key-" + UUID.randomUUID());
        SwapSession loaded = sessionStore.get(created.getSessionId());

        System.out.println("Session: " + loaded.getSessionId() + " hashlock " + loaded.getHashlock());

        assertEquals(SwapStatus.INITIALIZED, loaded.getStatus());
        assertEquals(created.getHashlock(), loaded.getHashlock());
        assertEquals(new BigInteger("1000000000000000000"), loaded.getSourceAmount());
        assertEquals(new BigInteger("2500000"), loaded.getDestinationAmount());
        assertEquals(5, loaded.getSteps().size());
        assertEquals(StepName.INITIALIZE, loaded.getSteps().get(0).getName());
        assertEquals(LegState.NONE, loaded.getSourceLeg().getState());
        assertNull(loaded.getSourceLeg().getEscrowId());
        assertEquals(30, loaded.getFees().getProtocolFeeBps());
        assertEquals(new BigInteger("3000000000000000"), loaded.getFees().getProtocolFeeAmount());

        printSuccess("Session persisted intact");
    }

    @Test
    @DisplayName("Creation and every status change write outbox facts in order")
    void outboxFacts() throws Exception {
        printTestHeader("Outbox facts");

        SwapSession created = sessionStore.create(params(MAKER));
        sessionStore.transition(created.getSessionId(), SwapStatus.EXECUTING);
        sessionStore.update(created.getSessionId(),
                s -> s.withStep(StepName.INITIALIZE, StepStatus.COMPLETED, Instant.now()));
        sessionStore.transition(created.getSessionId(), SwapStatus.SOURCE_LOCKING);

        List<OutboxEvent> events = outboxService.getEventsForAggregate("SwapSession", created.getSessionId());
        events.forEach(e -> System.out.println("  - " + e.getEventType() + ": " + e.getPayload()));

        assertEquals(3, events.size(), "Non-status updates write no fact");
        assertEquals(SessionCreatedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertEquals(SessionStatusChangedEvent.EVENT_TYPE, events.get(1).getEventType());
        assertEquals(SessionStatusChangedEvent.EVENT_TYPE, events.get(2).getEventType());

        JsonNode createdFact = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(created.getHashlock(), createdFact.get("hashlock").asText());
        assertEquals(created.getSessionId().toString(), createdFact.get("sessionId").asText());
        assertFalse(events.get(0).getPayload().contains("secret"), "Facts never carry the secret");

        JsonNode changed = objectMapper.readTree(events.get(2).getPayload());
        assertEquals("executing", changed.get("previousStatus").asText());
        assertEquals("source_locking", changed.get("status").asText());

        printSuccess("Outbox mirrors status history");
    }

    @Test
    @DisplayName("Sessions are found by hashlock, escrow id and idempotency key")
    void lookups() {
        String key = "key-" + UUID.randomUUID();
        SwapSession created = sessionStore.create(UUID.randomUUID(), params(MAKER), key);
        sessionStore.update(created.getSessionId(), s -> s.withLeg(
                s.getSourceLeg().withEscrowId("0xescrow-src-1").submitted(Instant.now().plusSeconds(900), Instant.now()),
                Instant.now()));

        assertEquals(created.getSessionId(),
                sessionStore.findByHashlock(created.getHashlock().toUpperCase().replace("0X", "0x")).orElseThrow().getSessionId());
        SwapSession byEscrow = sessionStore.findByEscrowId("0xescrow-src-1").orElseThrow();
        assertEquals(created.getSessionId(), byEscrow.getSessionId());
        assertEquals(LegState.SUBMITTED, byEscrow.getSourceLeg().getState());
        assertEquals(created.getSessionId(), sessionStore.findIdByIdempotencyKey(key).orElseThrow());
        assertTrue(sessionStore.findIdByIdempotencyKey("unknown").isEmpty());
    }

    @Test
    @DisplayName("Duplicate idempotency key is rejected by the database and leaves no secret behind")
    void duplicateIdempotencyKey() {
        printTestHeader("Duplicate idempotency key");
        String key = "key-" + UUID.randomUUID();
        sessionStore.create(UUID.randomUUID(), params(MAKER), key);

        UUID loserId = UUID.randomUUID();
        assertThrows(DataIntegrityViolationException.class,
                () -> sessionStore.create(loserId, params(MAKER), key));

        assertTrue(sessionStore.find(loserId).isEmpty());
        assertTrue(secretVault.load(loserId).isEmpty());
        assertEquals(1, sessionRepository.count());
        printSuccess("Second insert rejected");
    }

    @Test
    @DisplayName("Listing filters by status and party, newest first")
    void listing() {
        String otherMaker = "0x3333333333333333333333333333333333333333";
        SwapSession first = sessionStore.create(params(MAKER));
        SwapSession second = sessionStore.create(params(otherMaker));
        SwapSession third = sessionStore.create(params(MAKER));
        sessionStore.transition(third.getSessionId(), SwapStatus.CANCELLING);

        List<SwapSession> all = sessionStore.list(SessionFilter.all());
        assertEquals(List.of(third.getSessionId(), second.getSessionId(), first.getSessionId()),
                all.stream().map(SwapSession::getSessionId).toList());

        List<SwapSession> makers = sessionStore.list(SessionFilter.builder().maker(MAKER).build());
        assertEquals(2, makers.size());

        List<SwapSession> initialized = sessionStore.list(SessionFilter.builder()
                .statuses(Set.of(SwapStatus.INITIALIZED)).maker(MAKER).build());
        assertEquals(List.of(first.getSessionId()), initialized.stream().map(SwapSession::getSessionId).toList());

        List<SwapSession> paged = sessionStore.list(SessionFilter.builder().limit(1).offset(1).build());
        assertEquals(List.of(second.getSessionId()), paged.stream().map(SwapSession::getSessionId).toList());

        List<SwapSession> unaligned = sessionStore.list(SessionFilter.builder().limit(2).offset(1).build());
        assertEquals(List.of(second.getSessionId(), first.getSessionId()),
                unaligned.stream().map(SwapSession::getSessionId).toList());
        assertTrue(sessionStore.list(SessionFilter.builder().limit(2).offset(3).build()).isEmpty());

        assertEquals(3, sessionStore.countActive());
    }

    @Test
    @DisplayName("Secret is stored sealed and opens the session's hashlock")
    void sealedSecret() {
        SwapSession created = sessionStore.create(params(MAKER));

        String stored = sealedSecretRepository.findById(created.getSessionId()).orElseThrow().getSealedSecret();
        String secret = secretVault.load(created.getSessionId()).orElseThrow();

        assertNotEquals(secret, stored);
        assertFalse(stored.contains(secret.substring(2)));
        assertTrue(Hashlocks.matches(secret, created.getHashlock()));

        assertTrue(secretVault.markDisclosed(created.getSessionId(), Instant.now()));
        assertFalse(secretVault.markDisclosed(created.getSessionId(), Instant.now()));
    }

    @Test
    @DisplayName("Revealed secret on the session row is sealed and reloads in clear")
    void revealedSecretSealedOnRow() {
        printTestHeader("Revealed secret at rest");

        SwapSession created = sessionStore.create(params(MAKER));
        String secret = secretVault.load(created.getSessionId()).orElseThrow();
        assertNull(sessionRepository.findById(created.getSessionId()).orElseThrow().getSealedSecret());
        for (SwapStatus next : List.of(SwapStatus.EXECUTING, SwapStatus.SOURCE_LOCKING, SwapStatus.SOURCE_LOCKED,
                SwapStatus.DESTINATION_LOCKING, SwapStatus.BOTH_LOCKED)) {
            sessionStore.transition(created.getSessionId(), next);
        }

        sessionStore.update(created.getSessionId(), s -> s.withSecret(secret, Instant.now()));
        String stored = sessionRepository.findById(created.getSessionId()).orElseThrow().getSealedSecret();
        System.out.println("Stored: " + stored);

        assertNotNull(stored);
        assertTrue(stored.startsWith("v1:"));
        assertFalse(stored.contains(secret.substring(2)));

        sessionStore.update(created.getSessionId(), s -> s.markDegraded("test", Instant.now()));
        assertEquals(stored, sessionRepository.findById(created.getSessionId()).orElseThrow().getSealedSecret(),
                "Sealed once, not on every save");
        assertEquals(secret, sessionStore.get(created.getSessionId()).getSecret());
        printSuccess("Secret never stored in clear");
    }
}
