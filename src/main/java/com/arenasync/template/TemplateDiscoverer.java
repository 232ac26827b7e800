package com.arenasync.template;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Finds template definitions inside a fetched source tree, either through a {@code templates.yaml}
 * index at the source root or by scanning the immediate subdirectories of the templates path.
 */
public class TemplateDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(TemplateDiscoverer.class);

    public static final String TEMPLATE_FILE = "template.yaml";
    public static final String INDEX_FILE = "templates.yaml";
    public static final String DEFAULT_TEMPLATES_PATH = "templates";

    private static final Set<String> RENDERABLE_EXTENSIONS = Set.of("yaml", "yml", "json", "txt", "md", "tmpl", "tpl");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Path sourcePath;
    private final String templatesPath;

    public TemplateDiscoverer(Path sourcePath, String templatesPath) {
        this.sourcePath = sourcePath;
        String normalized = templatesPath == null || templatesPath.isBlank() ? DEFAULT_TEMPLATES_PATH : templatesPath.strip();
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        this.templatesPath = normalized;
    }

    public List<Template> discover() throws TemplateParseException {
        Path indexFile = sourcePath.resolve(INDEX_FILE);
        if (Files.isRegularFile(indexFile)) {
            return discoverFromIndex(indexFile);
        }
        return discoverFromDirectory();
    }

    private List<Template> discoverFromIndex(Path indexFile) throws TemplateParseException {
        IndexDocument index;
        try {
            index = yamlMapper.readValue(indexFile.toFile(), IndexDocument.class);
        } catch (IOException e) {
            throw new TemplateParseException("failed to parse " + INDEX_FILE + ": " + e.getMessage(), e);
        }
        List<Template> templates = new ArrayList<>();
        if (index == null || index.templates() == null) {
            return templates;
        }
        for (IndexEntry entry : index.templates()) {
            if (entry == null || entry.path() == null || entry.path().isBlank()) {
                throw new TemplateParseException("template index entry " + (entry == null ? "" : entry.name()) + " has no path");
            }
            Path templateDir = sourcePath.resolve(entry.path().strip()).normalize();
            if (!templateDir.startsWith(sourcePath.normalize())) {
                throw new TemplateParseException("template path escapes the source: " + entry.path());
            }
            templates.add(loadTemplate(templateDir));
        }
        log.debug("template.discovery.index source={} count={}", sourcePath, templates.size());
        return templates;
    }

    private List<Template> discoverFromDirectory() throws TemplateParseException {
        Path templatesDir = sourcePath.resolve(templatesPath);
        List<Template> templates = new ArrayList<>();
        if (!Files.isDirectory(templatesDir)) {
            log.debug("template.discovery.skip source={} reason=missing-templates-dir path={}", sourcePath, templatesPath);
            return templates;
        }
        List<Path> candidates;
        try (Stream<Path> children = Files.list(templatesDir)) {
            candidates = children
                    .filter(Files::isDirectory)
                    .filter(dir -> Files.isRegularFile(dir.resolve(TEMPLATE_FILE)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TemplateParseException("failed to list templates directory " + templatesPath + ": " + e.getMessage(), e);
        }
        for (Path candidate : candidates) {
            templates.add(loadTemplate(candidate));
        }
        log.debug("template.discovery.scan source={} count={}", sourcePath, templates.size());
        return templates;
    }

    Template loadTemplate(Path templateDir) throws TemplateParseException {
        Path file = templateDir.resolve(TEMPLATE_FILE);
        String relativePath = relativePath(templateDir);
        TemplateDocument document;
        try {
            document = yamlMapper.readValue(file.toFile(), TemplateDocument.class);
        } catch (IOException e) {
            throw new TemplateParseException("failed to parse " + relativePath + "/" + TEMPLATE_FILE + ": " + e.getMessage(), e);
        }
        if (document == null || document.metadata() == null
                || document.metadata().name() == null || document.metadata().name().isBlank()) {
            throw new TemplateParseException("template " + relativePath + " is missing metadata.name");
        }

        String name = document.metadata().name().strip();
        TemplateSpec spec = document.spec() == null ? new TemplateSpec(null, null, null, null, null, null) : document.spec();
        String displayName = spec.displayName() == null || spec.displayName().isBlank() ? name : spec.displayName();
        List<TemplateFileSpec> files = spec.files() == null || spec.files().isEmpty()
                ? defaultFiles(templateDir)
                : spec.files();

        return new Template(
                name,
                document.metadata().version(),
                displayName,
                spec.description(),
                spec.category(),
                spec.tags(),
                spec.variables(),
                files,
                relativePath);
    }

    private List<TemplateFileSpec> defaultFiles(Path templateDir) throws TemplateParseException {
        List<TemplateFileSpec> files = new ArrayList<>();
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(templateDir)) {
            stream.forEach(entries::add);
        } catch (IOException e) {
            throw new TemplateParseException("failed to list template directory " + relativePath(templateDir) + ": " + e.getMessage(), e);
        }
        entries.sort(null);
        for (Path entry : entries) {
            String fileName = entry.getFileName().toString();
            if (fileName.startsWith(".") || fileName.equals(TEMPLATE_FILE)) {
                continue;
            }
            if (Files.isDirectory(entry)) {
                files.add(new TemplateFileSpec(fileName + "/", false));
            } else {
                files.add(new TemplateFileSpec(fileName, isRenderable(fileName)));
            }
        }
        return files;
    }

    static boolean isRenderable(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return false;
        }
        return RENDERABLE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private String relativePath(Path templateDir) {
        return sourcePath.normalize().relativize(templateDir.normalize()).toString().replace('\\', '/');
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexDocument(List<IndexEntry> templates) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexEntry(String name, String path) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplateDocument(TemplateMetadata metadata, TemplateSpec spec) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplateMetadata(String name, String version) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplateSpec(
            String displayName,
            String description,
            String category,
            List<String> tags,
            List<TemplateVariable> variables,
            List<TemplateFileSpec> files) {
    }
}
