package com.arenasync.reconcile;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.source.ArenaTemplateSource;
import com.arenasync.source.ArenaTemplateSourceStatus;
import com.arenasync.source.SourceKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads one {@code ArenaTemplateSource} manifest per YAML file below {@code sourcesDir} and keeps
 * each status as {@code {statusDir}/{namespace}/{name}.json}. Status written into a manifest is
 * ignored.
 */
public class ManifestSourceStore implements SourceStore {
    private static final Logger log = LoggerFactory.getLogger(ManifestSourceStore.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path sourcesDir;
    private final Path statusDir;

    public ManifestSourceStore(Path sourcesDir, Path statusDir) {
        this.sourcesDir = sourcesDir;
        this.statusDir = statusDir;
    }

    @Override
    public List<SourceKey> list() throws IOException {
        return new ArrayList<>(loadManifests().keySet());
    }

    @Override
    public Optional<ArenaTemplateSource> get(SourceKey key) throws IOException {
        ArenaTemplateSource source = loadManifests().get(key);
        if (source == null) {
            return Optional.empty();
        }
        Path statusFile = statusPath(key);
        if (Files.isRegularFile(statusFile)) {
            source.setStatus(jsonMapper.readValue(statusFile.toFile(), ArenaTemplateSourceStatus.class));
        } else {
            source.setStatus(new ArenaTemplateSourceStatus());
        }
        return Optional.of(source);
    }

    @Override
    public void updateStatus(ArenaTemplateSource source) throws IOException {
        Path statusFile = statusPath(source.key());
        Path tmp = statusFile.resolveSibling(statusFile.getFileName() + ".tmp");
        Files.createDirectories(statusFile.getParent());
        jsonMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), source.getStatus());
        try {
            Files.move(tmp, statusFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, statusFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void deleteStatus(SourceKey key) throws IOException {
        Files.deleteIfExists(statusPath(key));
    }

    public Optional<ArenaTemplateSourceStatus> readStatus(SourceKey key) throws IOException {
        Path statusFile = statusPath(key);
        if (!Files.isRegularFile(statusFile)) {
            return Optional.empty();
        }
        return Optional.of(jsonMapper.readValue(statusFile.toFile(), ArenaTemplateSourceStatus.class));
    }

    private Map<SourceKey, ArenaTemplateSource> loadManifests() throws IOException {
        Map<SourceKey, ArenaTemplateSource> manifests = new LinkedHashMap<>();
        if (!Files.isDirectory(sourcesDir)) {
            return manifests;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourcesDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
        }
        for (Path file : files) {
            ArenaTemplateSource source;
            try {
                source = yamlMapper.readValue(file.toFile(), ArenaTemplateSource.class);
            } catch (IOException e) {
                log.warn("manifest.skip file={} reason={}", file, e.getMessage());
                continue;
            }
            if (source == null || source.getMetadata() == null
                    || source.getMetadata().name() == null || source.getMetadata().name().isBlank()) {
                log.warn("manifest.skip file={} reason=missing-metadata-name", file);
                continue;
            }
            SourceKey key = source.key();
            if (manifests.containsKey(key)) {
                log.warn("manifest.duplicate key={} file={}", key, file);
                continue;
            }
            source.setStatus(new ArenaTemplateSourceStatus());
            manifests.put(key, source);
        }
        return manifests;
    }

    private Path statusPath(SourceKey key) {
        return statusDir.resolve(key.namespace()).resolve(key.name() + ".json");
    }
}
