package com.arenasync.fetch;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileTreesTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCopyTreeSkippingExcludedNamesAndKeepingSymlinks() throws Exception {
        Path source = tempDir.resolve("source");
        Files.createDirectories(source.resolve(".git/objects"));
        Files.createDirectories(source.resolve("templates/app"));
        Files.writeString(source.resolve(".git/HEAD"), "ref: refs/heads/main");
        Files.writeString(source.resolve("templates/app/template.yaml"), "metadata:\n  name: app\n");
        Files.createSymbolicLink(source.resolve("latest"), Path.of("templates/app"));

        Path target = tempDir.resolve("target");
        FileTrees.copyTree(source, target, Set.of(".git"));

        assertFalse(Files.exists(target.resolve(".git")));
        assertEquals("metadata:\n  name: app\n", Files.readString(target.resolve("templates/app/template.yaml")));
        assertTrue(Files.isSymbolicLink(target.resolve("latest")));
        assertEquals(Path.of("templates/app"), Files.readSymbolicLink(target.resolve("latest")));
    }

    @Test
    void shouldRelocateAndRemoveSource() throws Exception {
        Path source = tempDir.resolve("artifact");
        Files.createDirectories(source.resolve("nested"));
        Files.writeString(source.resolve("nested/file.txt"), "content");
        Path target = tempDir.resolve("versions/abc");
        Files.createDirectories(target.getParent());

        FileTrees.relocate(source, target);

        assertFalse(Files.exists(source));
        assertEquals("content", Files.readString(target.resolve("nested/file.txt")));
    }

    @Test
    void shouldMeasureAndDeleteTrees() throws Exception {
        Path root = tempDir.resolve("sized");
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/x"), "12345");
        Files.writeString(root.resolve("y"), "123");

        assertEquals(8, FileTrees.size(root));

        FileTrees.deleteRecursively(root);
        FileTrees.deleteRecursively(root);
        assertFalse(Files.exists(root));
    }
}
