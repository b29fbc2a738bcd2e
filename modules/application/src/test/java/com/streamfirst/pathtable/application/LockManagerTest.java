package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.adapters.InMemoryStorageAdapter;
import com.streamfirst.pathtable.domain.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class LockManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final Duration POLL = Duration.ofMillis(2);

    private InMemoryStorageAdapter storage;
    private LockManager locks;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageAdapter();
        locks = new LockManager(storage, "/locks/");
    }

    @Test
    void testSentinelExistsWhileHeld() {
        try (LockHandle handle = locks.acquire("orders", TIMEOUT, POLL)) {
            assertEquals("/locks/.lock_orders", handle.sentinelPath());
            assertTrue(storage.exists("/locks/.lock_orders"));
            assertThat(locks.lockInfo("orders")).isPresent();
        }
        assertFalse(storage.exists("/locks/.lock_orders"));
        assertThat(locks.lockInfo("orders")).isEmpty();
    }

    @Test
    void testHeldLockTimesOut() {
        LockManager otherProcess = new LockManager(storage, "/locks");
        try (LockHandle ignored = otherProcess.acquire("orders", TIMEOUT, POLL)) {
            long start = System.nanoTime();
            LockTimeoutException error = assertThrows(LockTimeoutException.class,
                () -> locks.acquire("orders", Duration.ofMillis(50), Duration.ofMillis(10)));
            assertEquals("orders", error.getLockName());
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(50);
        }
        try (LockHandle handle = locks.acquire("orders", Duration.ZERO, POLL)) {
            assertFalse(handle.isReleased(), "Lock is free once the other holder released it");
        }
    }

    @Test
    void testShortFormsUseConfiguredDefaults() {
        LockManager configured = new LockManager(storage, "/locks", Duration.ofMillis(40), Duration.ofMillis(5));
        assertEquals(Duration.ofMillis(40), configured.defaultTimeout());
        assertEquals(Duration.ofMillis(5), configured.defaultPollInterval());

        try (LockHandle ignored = locks.acquire("orders", TIMEOUT, POLL)) {
            long start = System.nanoTime();
            assertThrows(LockTimeoutException.class, () -> configured.acquire("orders"));
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
        }

        assertEquals("done", configured.withLock("orders", () -> "done"));
        assertFalse(storage.exists("/locks/.lock_orders"));
        assertEquals(Duration.ofSeconds(60), new LockManager(storage, "/locks").defaultTimeout());
    }

    @Test
    void testConcurrentHoldersNeverOverlap() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int[] counter = {0};
        log.info("Running 4 workers against lock 'counter'");
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        locks.withLock("counter", TIMEOUT, POLL, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            counter[0]++;
                            inside.decrementAndGet();
                        });
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get(), "Two holders were inside the critical section at once");
        assertEquals(100, counter[0]);
    }

    @Test
    void testLockIsReentrantForItsThread() {
        try (LockHandle outer = locks.acquire("orders", TIMEOUT, POLL)) {
            try (LockHandle inner = locks.acquire("orders", Duration.ZERO, POLL)) {
                assertFalse(inner.isReleased());
            }
            assertTrue(storage.exists(outer.sentinelPath()), "Outer hold keeps the sentinel");
        }
        assertThat(locks.lockInfo("orders")).isEmpty();
    }

    @Test
    void testExternallyRemovedSentinelCountsAsReleased() {
        LockHandle handle = locks.acquire("orders", TIMEOUT, POLL);
        storage.delete(handle.sentinelPath());

        handle.close();
        handle.close();

        assertTrue(handle.isReleased());
    }

    @Test
    void testReleaseHappensWhenActionFails() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("orders", TIMEOUT, POLL, (Runnable) () -> {
            throw new IllegalStateException("boom");
        }));

        assertThat(locks.lockInfo("orders")).isEmpty();
        assertEquals(42, locks.withLock("orders", TIMEOUT, POLL, () -> 42));
    }

    @Test
    void testForceRelease() {
        new LockManager(storage, "/locks").acquire("stuck", TIMEOUT, POLL);

        assertTrue(locks.forceRelease("stuck"));
        assertFalse(locks.forceRelease("stuck"));
        locks.acquire("stuck", Duration.ZERO, POLL).close();
    }

    @Test
    void testInterruptedWaitGivesUp() {
        LockManager otherProcess = new LockManager(storage, "/locks");
        try (LockHandle ignored = otherProcess.acquire("orders", TIMEOUT, POLL)) {
            Thread.currentThread().interrupt();
            LockTimeoutException error = assertThrows(LockTimeoutException.class,
                () -> locks.acquire("orders", TIMEOUT, Duration.ofMillis(100)));
            assertInstanceOf(InterruptedException.class, error.getCause());
            assertTrue(Thread.interrupted(), "Interrupt flag should be restored");
        }
    }

    @Test
    void testInvalidNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> locks.acquire("a/b", TIMEOUT, POLL));
        assertThrows(IllegalArgumentException.class, () -> locks.acquire("", TIMEOUT, POLL));
        assertEquals(".lock_x", new LockManager(storage, "").sentinelPath("x"));
    }
}
