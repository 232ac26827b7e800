package com.arenasync.source;

import java.util.Locale;
import java.util.Optional;

public enum SourceType {
    CONFIG_STORE("configmap", "configstore"),
    VERSION_CONTROL("git", "versioncontrol"),
    REGISTRY("oci", "registry");

    private final String wireName;
    private final String alias;

    SourceType(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SourceType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (SourceType type : values()) {
            if (type.wireName.equals(normalized) || type.alias.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
