package com.arenasync.reconcile;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import com.arenasync.fetch.FetchContext;
import com.arenasync.fetch.FetchException;
import com.arenasync.source.SourceKey;

/**
 * One outstanding fetch for a source. The result slot is filled exactly once, either by the
 * worker or by cancellation; later completions are rejected.
 */
final class FetchJob {
    private final SourceKey key;
    private final FetchContext context;
    private final Instant startedAt;
    private final long generation;
    private final AtomicReference<TemplateFetchResult> slot = new AtomicReference<>();
    private volatile Future<?> task;
    private volatile ScheduledFuture<?> watchdog;

    FetchJob(SourceKey key, FetchContext context, Instant startedAt, long generation) {
        this.key = key;
        this.context = context;
        this.startedAt = startedAt;
        this.generation = generation;
    }

    SourceKey key() {
        return key;
    }

    FetchContext context() {
        return context;
    }

    Instant startedAt() {
        return startedAt;
    }

    /**
     * Generation of the source spec this fetch was dispatched for.
     */
    long generation() {
        return generation;
    }

    void attach(Future<?> task, ScheduledFuture<?> watchdog) {
        this.task = task;
        this.watchdog = watchdog;
        if (isComplete()) {
            watchdog.cancel(false);
        }
    }

    boolean complete(TemplateFetchResult result) {
        if (!slot.compareAndSet(null, result)) {
            return false;
        }
        ScheduledFuture<?> timer = watchdog;
        if (timer != null) {
            timer.cancel(false);
        }
        return true;
    }

    boolean isComplete() {
        return slot.get() != null;
    }

    /**
     * Cancels the fetch and returns the failure result when this call filled the slot.
     */
    TemplateFetchResult cancel(String reason) {
        context.cancel(reason);
        TemplateFetchResult canceled = TemplateFetchResult.failure(null, new FetchException("fetch canceled: " + reason));
        boolean filled = complete(canceled);
        Future<?> running = task;
        if (running != null) {
            running.cancel(true);
        }
        return filled ? canceled : null;
    }
}
