package com.arenasync.fetch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Config entries stored as {@code {root}/{namespace}/{name}.yaml}. When the document carries no
 * {@code resourceVersion}, a digest of the file stands in for it so edits still change revision.
 */
public class YamlConfigStoreClient implements ConfigStoreClient {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Path root;

    public YamlConfigStoreClient(Path root) {
        this.root = root;
    }

    @Override
    public Optional<ConfigEntry> get(String namespace, String name) throws IOException {
        Path file = root.resolve(namespace).resolve(name + ".yaml");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        byte[] raw = Files.readAllBytes(file);
        ConfigDocument document = mapper.readValue(raw, ConfigDocument.class);
        if (document == null) {
            document = new ConfigDocument(null, null, null);
        }
        String resourceVersion = document.resourceVersion() == null || document.resourceVersion().isBlank()
                ? HexFormat.of().formatHex(DirectoryHasher.sha256().digest(raw), 0, 8)
                : document.resourceVersion().strip();
        return Optional.of(new ConfigEntry(resourceVersion, document.data(), document.binaryData()));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigDocument(String resourceVersion, Map<String, String> data, Map<String, byte[]> binaryData) {
    }
}
