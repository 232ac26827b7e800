package com.arenasync.source;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactStatus(
        String revision,
        String contentPath,
        String version,
        String checksum,
        long size,
        Instant lastUpdateTime) {
}
