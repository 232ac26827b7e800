package com.arenasync.fetch;

import java.util.Map;

public record ConfigEntry(String resourceVersion, Map<String, String> data, Map<String, byte[]> binaryData) {
    public ConfigEntry {
        resourceVersion = resourceVersion == null ? "" : resourceVersion;
        data = data == null ? Map.of() : Map.copyOf(data);
        binaryData = binaryData == null ? Map.of() : Map.copyOf(binaryData);
    }
}
