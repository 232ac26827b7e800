package com.arenasync.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cancellation and deadline state shared between a running fetch and the job that owns it.
 * Fetchers call {@link #checkCanceled()} between blocking steps.
 */
public class FetchContext {
    private final Clock clock;
    private final Instant deadline;
    private volatile String cancelReason;

    public FetchContext(Duration timeout) {
        this(timeout, Clock.systemUTC());
    }

    public FetchContext(Duration timeout, Clock clock) {
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
    }

    public void cancel(String reason) {
        if (cancelReason == null) {
            cancelReason = reason == null || reason.isBlank() ? "canceled" : reason;
        }
    }

    public boolean isCanceled() {
        return cancelReason != null;
    }

    public String cancelReason() {
        return cancelReason;
    }

    public Instant deadline() {
        return deadline;
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void checkCanceled() throws FetchException {
        if (cancelReason != null) {
            throw new FetchException("fetch canceled: " + cancelReason);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchException("fetch canceled: interrupted");
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new FetchException("fetch canceled: deadline exceeded");
        }
    }
}
