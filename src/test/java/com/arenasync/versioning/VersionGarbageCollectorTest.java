package com.arenasync.versioning;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionGarbageCollectorTest {

    private static final Instant BASE = Instant.parse("2024-05-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final VersionGarbageCollector collector = new VersionGarbageCollector();

    @Test
    void shouldDeleteOldestVersionsBeyondLimit() throws Exception {
        version("c", 3);
        version("a", 1);
        version("b", 2);
        version("d", 4);
        Files.writeString(tempDir.resolve("HEAD"), "d");

        List<String> deleted = collector.gc(tempDir, 2);

        assertEquals(List.of("a", "b"), deleted);
        assertEquals(List.of("HEAD", "c", "d"), children());
    }

    @Test
    void shouldBreakModificationTimeTiesByName() throws Exception {
        version("zeta", 1);
        version("alpha", 1);
        version("mid", 1);

        assertEquals(List.of("alpha"), collector.gc(tempDir, 2));
    }

    @Test
    void shouldDefaultToTenVersionsAndIgnoreMissingRoot() throws Exception {
        for (int i = 0; i < 11; i++) {
            version("v" + (char) ('a' + i), i);
        }

        assertEquals(List.of("va"), collector.gc(tempDir, 0));
        assertTrue(collector.gc(tempDir.resolve("absent"), 3).isEmpty());
        assertTrue(collector.gc(tempDir, 10).isEmpty());
    }

    private void version(String name, int hoursAfterBase) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve(name));
        Files.writeString(dir.resolve("content.txt"), name);
        Files.setLastModifiedTime(dir, FileTime.from(BASE.plusSeconds(3600L * hoursAfterBase)));
    }

    private List<String> children() throws Exception {
        try (Stream<Path> list = Files.list(tempDir)) {
            return list.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
