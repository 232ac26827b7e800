package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceMetadata(String name, String namespace, long generation) {
    public SourceMetadata {
        namespace = namespace == null || namespace.isBlank() ? "default" : namespace;
        generation = generation <= 0 ? 1 : generation;
    }

    public SourceKey key() {
        return new SourceKey(namespace, name);
    }
}
