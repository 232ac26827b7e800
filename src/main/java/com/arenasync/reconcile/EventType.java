package com.arenasync.reconcile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    NORMAL("Normal"),
    WARNING("Warning");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
