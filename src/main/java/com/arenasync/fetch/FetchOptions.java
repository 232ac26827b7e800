package com.arenasync.fetch;

import java.nio.file.Path;
import java.time.Duration;

public record FetchOptions(Path workDir, Duration timeout) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public FetchOptions {
        workDir = workDir == null ? Path.of(System.getProperty("java.io.tmpdir")) : workDir;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public static FetchOptions defaults() {
        return new FetchOptions(null, null);
    }
}
