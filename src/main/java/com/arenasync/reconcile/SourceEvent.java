package com.arenasync.reconcile;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceEvent(
        Instant timestamp,
        String namespace,
        String name,
        EventType type,
        String reason,
        String message) {
}
