package com.flagship.swap_coordinator.coordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Per-session serialization on a shared pool.
 */
class SessionWorkersTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(8);
    private final SessionWorkers workers = new SessionWorkers(pool);

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Tasks of one session run one at a time in submission order")
    void serializesPerSession() throws InterruptedException {
        printTestHeader("Per-session ordering under concurrency");

        UUID sessionId = UUID.randomUUID();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(500);

        for (int i = 0; i < 500; i++) {
            int n = i;
            workers.submit(sessionId, () -> {
                int now = concurrent.incrementAndGet();
                maxConcurrent.accumulateAndGet(now, Math::max);
                order.add(n);
                concurrent.decrementAndGet();
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(1, maxConcurrent.get());
        for (int i = 0; i < 500; i++) {
            assertEquals(i, order.get(i));
        }
        printSuccess("500 tasks ran in order with no overlap");
    }

    @Test
    @DisplayName("A blocked session does not hold up another session")
    void isolatesSessions() throws InterruptedException {
        UUID slow = UUID.randomUUID();
        UUID fast = UUID.randomUUID();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(1);

        workers.submit(slow, () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        workers.submit(fast, fastDone::countDown);

        assertTrue(fastDone.await(2, TimeUnit.SECONDS));
        release.countDown();
    }

    @Test
    @DisplayName("A failing task does not stop the mailbox; call exposes results and errors")
    void failuresAndResults() throws Exception {
        UUID sessionId = UUID.randomUUID();

        workers.submit(sessionId, () -> {
            throw new IllegalStateException("boom");
        });
        assertEquals(42, workers.call(sessionId, () -> 42).get(2, TimeUnit.SECONDS));

        CompletableFuture<Integer> failed = workers.call(sessionId, () -> {
            throw new IllegalArgumentException("bad");
        });
        ExecutionException error = assertThrows(ExecutionException.class, () -> failed.get(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    @DisplayName("Idle mailboxes are released")
    void releasesIdleMailboxes() throws Exception {
        UUID sessionId = UUID.randomUUID();
        workers.call(sessionId, () -> "done").get(2, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 2000;
        while (workers.activeMailboxes() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, workers.activeMailboxes());
    }
}
