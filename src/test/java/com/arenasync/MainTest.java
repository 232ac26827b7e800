package com.arenasync;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configFile;

    @BeforeEach
    void setUp() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("sources"));
        Files.writeString(sources.resolve("catalog.yaml"), String.join("\n",
                "metadata:",
                "  name: catalog",
                "  namespace: team",
                "spec:",
                "  type: configmap",
                "  configMap:",
                "    name: catalog-templates",
                "  syncInterval: 1h",
                ""));
        Path configStore = Files.createDirectories(tempDir.resolve("config-store/team"));
        Files.writeString(configStore.resolve("catalog-templates.yaml"), String.join("\n",
                "resourceVersion: \"42\"",
                "data:",
                "  templates__starter__template.yaml: |",
                "    metadata:",
                "      name: starter",
                "  templates__starter__arena.yaml: \"kind: Arena\"",
                ""));
        configFile = writeConfig(tempDir.resolve("content").toString());
    }

    @Test
    void shouldReconcileSourcesAndPrintSummary() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int exitCode = run(out, "--config", configFile.toString(), "--max-wait-ms", "20000");

        assertEquals(0, exitCode);
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(summary.startsWith("team/catalog Ready "), summary);
        assertTrue(summary.contains("templates=1"), summary);
        assertTrue(Files.isRegularFile(tempDir.resolve("status/team/catalog.json")));
        assertTrue(Files.isRegularFile(tempDir.resolve("content/arena-ws/team/arena/template-sources/catalog/.arena/HEAD")));
        assertTrue(Files.isRegularFile(tempDir.resolve("content/arena-ws/team/arena/template-indexes/catalog.json")));
        assertTrue(Files.readAllLines(tempDir.resolve("events.jsonl")).size() >= 2);
    }

    @Test
    void shouldListVersionsCollectGarbageAndPurge() throws Exception {
        assertEquals(0, run(new ByteArrayOutputStream(), "--config", configFile.toString(), "--max-wait-ms", "20000"));
        String head = Files.readString(tempDir.resolve("content/arena-ws/team/arena/template-sources/catalog/.arena/HEAD"));

        ByteArrayOutputStream versions = new ByteArrayOutputStream();
        assertEquals(0, run(versions, "--config", configFile.toString(), "--mode", "versions", "-n", "team", "--name", "catalog"));
        String listing = versions.toString(StandardCharsets.UTF_8);
        assertTrue(listing.startsWith("HEAD " + head), listing);
        assertTrue(listing.contains("* " + head + " "), listing);

        ByteArrayOutputStream gc = new ByteArrayOutputStream();
        assertEquals(0, run(gc, "--config", configFile.toString(), "--mode", "gc", "-n", "team", "--name", "catalog", "--keep", "1"));
        assertEquals("", gc.toString(StandardCharsets.UTF_8));

        ByteArrayOutputStream purge = new ByteArrayOutputStream();
        assertEquals(0, run(purge, "--config", configFile.toString(), "--mode", "purge", "-n", "team", "--name", "catalog"));
        assertEquals("purged team/catalog", purge.toString(StandardCharsets.UTF_8).strip());
        assertFalse(Files.exists(tempDir.resolve("content/arena-ws/team/arena/template-sources/catalog")));
        assertFalse(Files.exists(tempDir.resolve("content/arena-ws/team/arena/template-indexes/catalog.json")));
        assertFalse(Files.exists(tempDir.resolve("status/team/catalog.json")));
    }

    @Test
    void shouldRequireNameForMaintenanceModes() throws Exception {
        assertEquals(2, run(new ByteArrayOutputStream(), "--config", configFile.toString(), "--mode", "versions"));
    }

    @Test
    void shouldRejectMaintenanceWithoutContentStore() throws Exception {
        Path unconfigured = writeConfig("");

        assertEquals(2, run(new ByteArrayOutputStream(), "--config", unconfigured.toString(), "--mode", "gc", "--name", "catalog"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(2, run(new ByteArrayOutputStream(), "--mode", "rollback"));
    }

    private int run(ByteArrayOutputStream out, String... args) {
        PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8);
        return new CommandLine(new Main(stream)).execute(args);
    }

    private Path writeConfig(String contentPath) throws Exception {
        Path file = tempDir.resolve(contentPath.isEmpty() ? "unconfigured.yml" : "application.yml");
        Files.writeString(file, String.join("\n",
                "engine:",
                "  workspaceContentPath: \"" + contentPath + "\"",
                "  workers: 1",
                "  fetchPollIntervalMs: 50",
                "  retryBaseDelayMs: 50",
                "  retryMaxDelayMs: 200",
                "  workDir: \"" + tempDir.resolve("work") + "\"",
                "stores:",
                "  sourcesPath: \"" + tempDir.resolve("sources") + "\"",
                "  statusPath: \"" + tempDir.resolve("status") + "\"",
                "  configStorePath: \"" + tempDir.resolve("config-store") + "\"",
                "  secretStorePath: \"" + tempDir.resolve("secrets") + "\"",
                "  eventLogPath: \"" + tempDir.resolve("events.jsonl") + "\"",
                "workspaces:",
                "  team: arena-ws",
                ""));
        return file;
    }
}
