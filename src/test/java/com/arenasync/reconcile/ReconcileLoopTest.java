package com.arenasync.reconcile;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.Test;

import com.arenasync.source.SourceKey;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcileLoopTest {

    private static final SourceKey KEY = new SourceKey("team", "catalog");

    @Test
    void shouldCollapseDuplicateRequestsForQueuedKey() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (ReconcileLoop loop = new ReconcileLoop(key -> {
            calls.incrementAndGet();
            return ReconcileResult.done();
        }, 2, Duration.ofMillis(10), Duration.ofMillis(50))) {
            loop.enqueue(KEY);
            loop.enqueue(KEY);
            loop.enqueue(KEY);
            assertFalse(loop.isIdle());

            loop.start();

            awaitCondition(() -> loop.isIdle() && loop.completedPasses() == 1);
            assertEquals(1, calls.get());
        }
    }

    @Test
    void shouldRunOneMorePassWhenKeyIsRequestedDuringReconcile() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Reconciler blocking = key -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ReconcileResult.done();
        };

        try (ReconcileLoop loop = new ReconcileLoop(blocking, 4, Duration.ofMillis(10), Duration.ofMillis(50))) {
            loop.start();
            loop.enqueue(KEY);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            loop.enqueue(KEY);
            loop.enqueue(KEY);
            loop.enqueue(KEY);
            release.countDown();

            awaitCondition(() -> loop.isIdle() && loop.completedPasses() == 2);
            assertEquals(2, calls.get());
        }
    }

    @Test
    void shouldRetryFailedPassesWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Reconciler flaky = key -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("status write failed");
            }
            return ReconcileResult.done();
        };

        try (ReconcileLoop loop = new ReconcileLoop(flaky, 1, Duration.ofMillis(10), Duration.ofMillis(40))) {
            loop.start();
            loop.enqueue(KEY);

            awaitCondition(() -> calls.get() == 3 && loop.isIdle());
        }
    }

    @Test
    void shouldRequeueAfterRequestedDelay() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Reconciler requeueOnce = key -> calls.incrementAndGet() == 1
                ? ReconcileResult.requeue(Duration.ofMillis(30))
                : ReconcileResult.done();

        try (ReconcileLoop loop = new ReconcileLoop(requeueOnce, 1, Duration.ofMillis(10), Duration.ofMillis(50))) {
            loop.start();
            loop.enqueue(KEY);

            awaitCondition(() -> calls.get() == 2);
        }
    }

    @Test
    void shouldKeepEarliestDelayedRequest() throws Exception {
        try (ReconcileLoop loop = new ReconcileLoop(key -> ReconcileResult.done(), 1, Duration.ofMillis(10), Duration.ofMillis(50))) {
            loop.enqueueAfter(KEY, Duration.ofMillis(50));
            loop.enqueueAfter(KEY, Duration.ofMinutes(10));
            assertTrue(loop.isIdle());

            awaitCondition(() -> !loop.isIdle());
        }
    }

    @Test
    void shouldDoubleBackoffUpToCap() {
        try (ReconcileLoop loop = new ReconcileLoop(key -> ReconcileResult.done(), 1, Duration.ofMillis(100), Duration.ofSeconds(1))) {
            assertEquals(Duration.ofMillis(100), loop.backoff(1));
            assertEquals(Duration.ofMillis(200), loop.backoff(2));
            assertEquals(Duration.ofMillis(400), loop.backoff(3));
            assertEquals(Duration.ofSeconds(1), loop.backoff(5));
            assertEquals(Duration.ofSeconds(1), loop.backoff(64));
        }
    }

    static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not reached within 10s");
            }
            Thread.sleep(10);
        }
    }
}
