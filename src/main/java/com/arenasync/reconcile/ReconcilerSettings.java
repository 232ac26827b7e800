package com.arenasync.reconcile;

import java.nio.file.Path;
import java.time.Duration;

public record ReconcilerSettings(Duration pollInterval, Duration indexRetryDelay, Path workDir) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_INDEX_RETRY_DELAY = Duration.ofSeconds(30);

    public ReconcilerSettings {
        pollInterval = pollInterval == null || pollInterval.isNegative() || pollInterval.isZero() ? DEFAULT_POLL_INTERVAL : pollInterval;
        indexRetryDelay = indexRetryDelay == null || indexRetryDelay.isNegative() || indexRetryDelay.isZero()
                ? DEFAULT_INDEX_RETRY_DELAY
                : indexRetryDelay;
        workDir = workDir == null ? Path.of(System.getProperty("java.io.tmpdir")) : workDir;
    }
}
