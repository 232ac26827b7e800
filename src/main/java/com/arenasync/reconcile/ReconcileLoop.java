package com.arenasync.reconcile;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.source.SourceKey;

/**
 * Work queue driving a {@link Reconciler}. A key is queued at most once, and a key that is being
 * reconciled is never handed to a second worker: requests that arrive meanwhile mark it dirty and
 * it is queued again once the running pass finishes.
 */
public class ReconcileLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconcileLoop.class);

    private final Reconciler reconciler;
    private final int workers;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;

    private final LinkedBlockingQueue<SourceKey> queue = new LinkedBlockingQueue<>();
    private final Object lock = new Object();
    private final Set<SourceKey> queued = new HashSet<>();
    private final Set<SourceKey> processing = new HashSet<>();
    private final Set<SourceKey> dirty = new HashSet<>();
    private final Map<SourceKey, ScheduledFuture<?>> delayed = new HashMap<>();
    private final Map<SourceKey, Integer> failures = new HashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger passes = new AtomicInteger();

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workerPool;

    public ReconcileLoop(Reconciler reconciler, int workers, Duration retryBaseDelay, Duration retryMaxDelay) {
        this.reconciler = reconciler;
        this.workers = Math.max(1, workers);
        this.retryBaseDelay = retryBaseDelay;
        this.retryMaxDelay = retryMaxDelay;
        AtomicInteger threadIds = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reconcile-requeue");
            thread.setDaemon(true);
            return thread;
        });
        this.workerPool = Executors.newFixedThreadPool(this.workers, runnable -> {
            Thread thread = new Thread(runnable, "reconcile-worker-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < workers; i++) {
            workerPool.submit(this::work);
        }
        log.info("reconcile.loop.started workers={}", workers);
    }

    public void enqueue(SourceKey key) {
        synchronized (lock) {
            ScheduledFuture<?> pending = delayed.remove(key);
            if (pending != null) {
                pending.cancel(false);
            }
            if (processing.contains(key)) {
                dirty.add(key);
                return;
            }
            if (queued.add(key)) {
                queue.offer(key);
            }
        }
    }

    /**
     * Queues {@code key} after {@code delay}. When a delayed request for the key is already
     * pending, the earlier of the two wins.
     */
    public void enqueueAfter(SourceKey key, Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            enqueue(key);
            return;
        }
        synchronized (lock) {
            ScheduledFuture<?> pending = delayed.get(key);
            if (pending != null && !pending.isDone() && pending.getDelay(TimeUnit.MILLISECONDS) <= delay.toMillis()) {
                return;
            }
            if (pending != null) {
                pending.cancel(false);
            }
            if (scheduler.isShutdown()) {
                return;
            }
            ScheduledFuture<?>[] holder = new ScheduledFuture<?>[1];
            holder[0] = scheduler.schedule(() -> {
                synchronized (lock) {
                    if (delayed.get(key) != holder[0]) {
                        return;
                    }
                    delayed.remove(key);
                }
                enqueue(key);
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
            delayed.put(key, holder[0]);
        }
    }

    public boolean isIdle() {
        synchronized (lock) {
            return queued.isEmpty() && processing.isEmpty() && dirty.isEmpty();
        }
    }

    public int completedPasses() {
        return passes.get();
    }

    Duration backoff(int consecutiveFailures) {
        long base = Math.max(1L, retryBaseDelay.toMillis());
        long cap = Math.max(base, retryMaxDelay.toMillis());
        int shift = Math.min(Math.max(0, consecutiveFailures - 1), 30);
        long delay = base << shift;
        return Duration.ofMillis(delay <= 0 || delay > cap ? cap : delay);
    }

    private void work() {
        while (running.get()) {
            SourceKey key;
            try {
                key = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                continue;
            }
            synchronized (lock) {
                queued.remove(key);
                processing.add(key);
            }
            try {
                process(key);
            } finally {
                synchronized (lock) {
                    processing.remove(key);
                    if (dirty.remove(key) && queued.add(key)) {
                        queue.offer(key);
                    }
                }
                passes.incrementAndGet();
            }
        }
    }

    private void process(SourceKey key) {
        try {
            ReconcileResult result = reconciler.reconcile(key);
            synchronized (lock) {
                failures.remove(key);
            }
            result.requeueDelay().ifPresent(delay -> enqueueAfter(key, delay));
        } catch (Exception e) {
            int attempt;
            synchronized (lock) {
                attempt = failures.merge(key, 1, Integer::sum);
            }
            Duration retryIn = backoff(attempt);
            log.warn("reconcile.failed key={} attempt={} retryInMs={} reason={}", key, attempt, retryIn.toMillis(), e.getMessage(), e);
            enqueueAfter(key, retryIn);
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdownNow();
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("reconcile.loop.shutdown.timeout workers={}", workers);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("reconcile.loop.stopped passes={}", passes.get());
    }
}
