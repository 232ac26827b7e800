package com.arenasync.source;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(
        String type,
        ConditionStatus status,
        String reason,
        String message,
        long observedGeneration,
        Instant lastTransitionTime) {
    public Condition {
        status = status == null ? ConditionStatus.UNKNOWN : status;
        reason = reason == null ? "" : reason;
        message = message == null ? "" : message;
    }

    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }
}
