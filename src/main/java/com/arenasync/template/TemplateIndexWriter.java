package com.arenasync.template;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Publishes the discovered templates of a source as a JSON array under
 * {@code {base}/{workspace}/{namespace}/arena/template-indexes/{source}.json}.
 */
public class TemplateIndexWriter {
    private static final Logger log = LoggerFactory.getLogger(TemplateIndexWriter.class);

    static final String INDEX_DIRECTORY = "arena/template-indexes";

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path basePath;

    public TemplateIndexWriter(Path basePath) {
        this.basePath = basePath;
    }

    public boolean isConfigured() {
        return basePath != null;
    }

    public void writeIndex(String workspace, String namespace, String sourceName, List<Template> templates) throws IndexException {
        if (basePath == null) {
            return;
        }
        Path indexFile = indexPath(workspace, namespace, sourceName);
        Path tmpFile = indexFile.resolveSibling(indexFile.getFileName() + ".tmp");
        List<Template> payload = templates == null ? List.of() : templates;
        try {
            Files.createDirectories(indexFile.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmpFile.toFile(), payload);
            moveIntoPlace(tmpFile, indexFile);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmpFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new IndexException("failed to write template index for " + namespace + "/" + sourceName + ": " + e.getMessage(), e);
        }
        log.info("template.index.written workspace={} namespace={} source={} templates={}",
                workspace, namespace, sourceName, payload.size());
    }

    public List<Template> readIndex(String workspace, String namespace, String sourceName) throws IndexException {
        if (basePath == null) {
            return List.of();
        }
        Path indexFile = indexPath(workspace, namespace, sourceName);
        if (!Files.exists(indexFile)) {
            return List.of();
        }
        try {
            return mapper.readValue(indexFile.toFile(), new TypeReference<List<Template>>() {
            });
        } catch (IOException e) {
            throw new IndexException("failed to read template index for " + namespace + "/" + sourceName + ": " + e.getMessage(), e);
        }
    }

    public boolean deleteIndex(String workspace, String namespace, String sourceName) throws IndexException {
        if (basePath == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(indexPath(workspace, namespace, sourceName));
        } catch (IOException e) {
            throw new IndexException("failed to delete template index for " + namespace + "/" + sourceName + ": " + e.getMessage(), e);
        }
    }

    public Path indexPath(String workspace, String namespace, String sourceName) {
        return basePath.resolve(workspace).resolve(namespace).resolve(INDEX_DIRECTORY).resolve(sourceName + ".json");
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
