package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigStoreSource(String name) {
    public ConfigStoreSource {
        name = name == null ? "" : name.strip();
    }
}
