package com.vcc.admission.store;

import com.vcc.admission.MutableClock;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.RateWindow;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.model.WindowKey;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWindowCounterStoreTest {

    private static final Duration MINUTE = Duration.ofSeconds(60);
    private static final WindowKey IP_KEY = new WindowKey(LayerScope.IP, "10.0.0.1");

    @Test
    void testAllowsUpToLimitThenRejects() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:05Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);

        for (int i = 1; i <= 3; i++) {
            WindowDecision decision = store.checkAndIncrement(IP_KEY, 3, MINUTE).block();
            assertTrue(decision.allowed(), "Attempt " + i + " should be allowed");
            assertEquals(i, decision.currentCount());
        }

        WindowDecision rejected = store.checkAndIncrement(IP_KEY, 3, MINUTE).block();
        assertFalse(rejected.allowed());
        assertEquals(3, rejected.currentCount(), "Rejected attempt must not increment");
        assertEquals(0, rejected.remaining());
        assertEquals(Instant.parse("2024-03-10T12:01:00Z"), rejected.resetAt());
        assertEquals(55, rejected.retryAfterSeconds());
    }

    @Test
    void testNewWindowStartsFromZero() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:30Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);

        store.checkAndIncrement(IP_KEY, 2, MINUTE).block();
        store.checkAndIncrement(IP_KEY, 2, MINUTE).block();
        assertFalse(store.checkAndIncrement(IP_KEY, 2, MINUTE).block().allowed());

        clock.advance(Duration.ofSeconds(30));

        WindowDecision decision = store.checkAndIncrement(IP_KEY, 2, MINUTE).block();
        assertTrue(decision.allowed());
        assertEquals(1, decision.currentCount());
        assertEquals(Instant.parse("2024-03-10T12:02:00Z"), decision.resetAt());
    }

    @Test
    void testBoundaryBurstIsBoundedByTwiceTheLimit() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:59Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);

        int admitted = 0;
        for (int i = 0; i < 10; i++) {
            if (store.checkAndIncrement(IP_KEY, 5, MINUTE).block().allowed()) {
                admitted++;
            }
        }
        clock.advance(Duration.ofSeconds(2));
        for (int i = 0; i < 10; i++) {
            if (store.checkAndIncrement(IP_KEY, 5, MINUTE).block().allowed()) {
                admitted++;
            }
        }

        assertEquals(10, admitted);
    }

    @Test
    void testSubjectsAreCountedIndependently() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);
        WindowKey other = new WindowKey(LayerScope.IP, "10.0.0.2");
        WindowKey identity = new WindowKey(LayerScope.IDENTITY, "10.0.0.1");

        assertTrue(store.checkAndIncrement(IP_KEY, 1, MINUTE).block().allowed());
        assertFalse(store.checkAndIncrement(IP_KEY, 1, MINUTE).block().allowed());
        assertTrue(store.checkAndIncrement(other, 1, MINUTE).block().allowed());
        assertTrue(store.checkAndIncrement(identity, 1, MINUTE).block().allowed());
    }

    @Test
    void testConcurrentAttemptsAdmitExactlyTheLimit() throws InterruptedException {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);

        int numThreads = 16;
        int attemptsPerThread = 50;
        long limit = 100;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger allowCount = new AtomicInteger();
        AtomicInteger rejectCount = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < attemptsPerThread; j++) {
                        if (store.checkAndIncrement(IP_KEY, limit, MINUTE).block().allowed()) {
                            allowCount.incrementAndGet();
                        } else {
                            rejectCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(limit, allowCount.get());
        assertEquals(numThreads * attemptsPerThread - limit, rejectCount.get());
        assertEquals(limit, store.find(IP_KEY).block().count());
    }

    @Test
    void testCompactionHonoursGrace() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:10Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);
        store.checkAndIncrement(IP_KEY, 5, MINUTE).block();

        // Window ended 12:01:00; a cutoff at the end itself keeps it
        StepVerifier.create(store.compact(Instant.parse("2024-03-10T12:01:00Z")))
                .expectNext(0L)
                .verifyComplete();
        assertEquals(1, store.size());

        StepVerifier.create(store.compact(Instant.parse("2024-03-10T12:01:01Z")))
                .expectNext(1L)
                .verifyComplete();
        assertEquals(0, store.size());
    }

    @Test
    void testFindReturnsCurrentWindow() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:10Z");
        InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);

        StepVerifier.create(store.find(IP_KEY)).verifyComplete();

        store.checkAndIncrement(IP_KEY, 5, MINUTE).block();
        RateWindow window = store.find(IP_KEY).block();
        assertNotNull(window);
        assertEquals(Instant.parse("2024-03-10T12:00:00Z"), window.windowStart());
        assertEquals(1, window.count());
        assertEquals(5, window.limit());
    }
}
