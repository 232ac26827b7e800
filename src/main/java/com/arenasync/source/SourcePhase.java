package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourcePhase {
    PENDING("Pending"),
    FETCHING("Fetching"),
    READY("Ready"),
    ERROR("Error");

    private final String label;

    SourcePhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static SourcePhase fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SourcePhase phase : values()) {
            if (phase.label.equalsIgnoreCase(value.strip())) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
