package com.arenasync.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VariableType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ENUM("enum");

    private final String label;

    VariableType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static VariableType fromLabel(String value) {
        for (VariableType type : values()) {
            if (type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported variable type: " + value);
    }
}
