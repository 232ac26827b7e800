package com.arenasync.fetch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A fetched content tree. {@code path} is a directory owned by whoever consumes the artifact;
 * the consumer moves it into the content store or deletes it.
 */
public record Artifact(Path path, String checksum, String revision, long size, Instant lastModified) {
    public Artifact {
        Objects.requireNonNull(path, "path");
        checksum = checksum == null ? "" : checksum;
        revision = revision == null ? "" : revision;
        lastModified = lastModified == null ? Instant.EPOCH : lastModified;
    }
}
