package com.arenasync.template;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateIndexWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteIndexUnderWorkspaceAndNamespace() throws Exception {
        TemplateIndexWriter writer = new TemplateIndexWriter(tempDir);
        List<Template> templates = List.of(
                new Template("web-app", "1.0.0", "Web App", "", "apps", List.of("web"), null,
                        List.of(new TemplateFileSpec("app.yaml", true)), "templates/web-app"));

        writer.writeIndex("team-a", "default", "catalog", templates);

        Path index = tempDir.resolve("team-a/default/arena/template-indexes/catalog.json");
        assertTrue(Files.isRegularFile(index));
        assertFalse(Files.exists(index.resolveSibling("catalog.json.tmp")));
        assertEquals(templates, writer.readIndex("team-a", "default", "catalog"));
        assertTrue(Files.readString(index).contains("\"displayName\" : \"Web App\""));
    }

    @Test
    void shouldWriteEmptyArrayForNullTemplates() throws Exception {
        TemplateIndexWriter writer = new TemplateIndexWriter(tempDir);

        writer.writeIndex("ws", "ns", "empty", null);

        assertEquals("[ ]", Files.readString(writer.indexPath("ws", "ns", "empty")).strip());
        assertTrue(writer.readIndex("ws", "ns", "empty").isEmpty());
    }

    @Test
    void shouldDoNothingWithoutBasePath() throws Exception {
        TemplateIndexWriter writer = new TemplateIndexWriter(null);

        writer.writeIndex("ws", "ns", "catalog", List.of());

        assertFalse(writer.isConfigured());
        assertTrue(writer.readIndex("ws", "ns", "catalog").isEmpty());
        assertFalse(writer.deleteIndex("ws", "ns", "catalog"));
    }

    @Test
    void shouldReportIndexErrorWhenDirectoryCannotBeCreated() throws Exception {
        Files.createDirectories(tempDir.resolve("ws/ns"));
        Files.writeString(tempDir.resolve("ws/ns/arena"), "not a directory");
        TemplateIndexWriter writer = new TemplateIndexWriter(tempDir);

        IndexException error = assertThrows(IndexException.class, () -> writer.writeIndex("ws", "ns", "catalog", List.of()));

        assertEquals("IndexError", error.reason());
    }

    @Test
    void shouldDeleteIndex() throws Exception {
        TemplateIndexWriter writer = new TemplateIndexWriter(tempDir);
        writer.writeIndex("ws", "ns", "catalog", List.of());

        assertTrue(writer.deleteIndex("ws", "ns", "catalog"));
        assertFalse(Files.exists(writer.indexPath("ws", "ns", "catalog")));
    }
}
