package com.arenasync.versioning;

import java.time.Instant;

public record StoredVersion(String version, Instant lastModified, boolean head) {
}
