package com.arenasync.source;

import java.util.Objects;

public record SourceKey(String namespace, String name) {
    public SourceKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
