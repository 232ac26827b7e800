package com.arenasync.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads secrets from {@code {root}/{namespace}/{name}.yaml}. {@code data} values are base64
 * encoded; {@code stringData} values are plain text and win on clashes.
 */
public class YamlSecretStore implements SecretStore {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Path root;

    public YamlSecretStore(Path root) {
        this.root = root;
    }

    @Override
    public Optional<Map<String, byte[]>> get(String namespace, String name) throws IOException {
        Path file = root.resolve(namespace).resolve(name + ".yaml");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        SecretDocument document = mapper.readValue(file.toFile(), SecretDocument.class);
        Map<String, byte[]> values = new LinkedHashMap<>();
        if (document != null && document.data() != null) {
            values.putAll(document.data());
        }
        if (document != null && document.stringData() != null) {
            document.stringData().forEach((key, value) -> values.put(key, value.getBytes(StandardCharsets.UTF_8)));
        }
        return Optional.of(values);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SecretDocument(Map<String, byte[]> data, Map<String, String> stringData) {
    }
}
