package com.arenasync.reconcile;

import java.time.Duration;
import java.util.Optional;

public record ReconcileResult(Duration requeueAfter) {
    private static final ReconcileResult DONE = new ReconcileResult(null);

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult requeue(Duration after) {
        return new ReconcileResult(after.isNegative() ? Duration.ZERO : after);
    }

    public Optional<Duration> requeueDelay() {
        return Optional.ofNullable(requeueAfter);
    }
}
