package com.arenasync.versioning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.fetch.Artifact;
import com.arenasync.fetch.FileTrees;

/**
 * Content-addressed store for fetched artifacts. Each target keeps its snapshots under
 * {@code {base}/{workspace}/{namespace}/{target}/.arena/versions/{version}} and names the live
 * one in {@code .arena/HEAD}.
 */
public class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    static final String ARENA_DIR = ".arena";
    static final String VERSIONS_DIR = "versions";
    static final String HEAD_FILE = "HEAD";

    private final Path basePath;
    private final int maxVersions;
    private final VersionGarbageCollector garbageCollector;
    private final Clock clock;

    public ContentStore(Path basePath, int maxVersions) {
        this(basePath, maxVersions, new VersionGarbageCollector(), Clock.systemUTC());
    }

    ContentStore(Path basePath, int maxVersions, VersionGarbageCollector garbageCollector, Clock clock) {
        this.basePath = basePath == null ? null : basePath.toAbsolutePath().normalize();
        this.maxVersions = maxVersions;
        this.garbageCollector = garbageCollector;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return basePath != null;
    }

    public SyncResult sync(String workspace, String namespace, String targetPath, Artifact artifact) throws SyncException {
        if (basePath == null) {
            return SyncResult.empty();
        }
        if (artifact == null) {
            throw new SyncException("artifact is missing for " + targetPath);
        }
        String version = VersionIdentifiers.computeVersion(artifact);
        Path targetRoot = targetRoot(workspace, namespace, targetPath);
        Path versionsDir = targetRoot.resolve(ARENA_DIR).resolve(VERSIONS_DIR);
        Path versionDir = versionsDir.resolve(version);
        String contentPath = normalizeTarget(targetPath) + "/" + ARENA_DIR + "/" + VERSIONS_DIR + "/" + version;

        if (Files.isDirectory(versionDir, LinkOption.NOFOLLOW_LINKS)) {
            touch(versionDir);
            writeHead(targetRoot, version);
            log.info("content.sync.existing workspace={} namespace={} target={} version={}", workspace, namespace, targetPath, version);
            return new SyncResult(contentPath, version);
        }

        if (!Files.isDirectory(artifact.path())) {
            throw new SyncException("artifact directory does not exist: " + artifact.path());
        }
        try {
            Files.createDirectories(versionsDir);
            FileTrees.relocate(artifact.path(), versionDir);
        } catch (IOException e) {
            throw new SyncException("failed to store version " + version + " for " + targetPath + ": " + e.getMessage(), e);
        }
        touch(versionDir);
        writeHead(targetRoot, version);
        log.info("content.sync.stored workspace={} namespace={} target={} version={}", workspace, namespace, targetPath, version);

        garbageCollector.gc(versionsDir, maxVersions);
        return new SyncResult(contentPath, version);
    }

    public Optional<String> readHead(String workspace, String namespace, String targetPath) throws SyncException {
        if (basePath == null) {
            return Optional.empty();
        }
        Path head = targetRoot(workspace, namespace, targetPath).resolve(ARENA_DIR).resolve(HEAD_FILE);
        if (!Files.isRegularFile(head)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(head, StandardCharsets.UTF_8).strip();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException e) {
            throw new SyncException("failed to read HEAD for " + targetPath + ": " + e.getMessage(), e);
        }
    }

    public List<StoredVersion> listVersions(String workspace, String namespace, String targetPath) throws SyncException {
        if (basePath == null) {
            return List.of();
        }
        Path versionsDir = targetRoot(workspace, namespace, targetPath).resolve(ARENA_DIR).resolve(VERSIONS_DIR);
        if (!Files.isDirectory(versionsDir)) {
            return List.of();
        }
        String head = readHead(workspace, namespace, targetPath).orElse("");
        List<StoredVersion> versions = new ArrayList<>();
        try (Stream<Path> children = Files.list(versionsDir)) {
            for (Path child : children.toList()) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    String name = child.getFileName().toString();
                    versions.add(new StoredVersion(name, Files.getLastModifiedTime(child).toInstant(), name.equals(head)));
                }
            }
        } catch (IOException e) {
            throw new SyncException("failed to list versions for " + targetPath + ": " + e.getMessage(), e);
        }
        versions.sort(Comparator.comparing(StoredVersion::lastModified).reversed()
                .thenComparing(StoredVersion::version));
        return versions;
    }

    public List<String> collectGarbage(String workspace, String namespace, String targetPath, int limit) throws SyncException {
        if (basePath == null) {
            return List.of();
        }
        Path versionsDir = targetRoot(workspace, namespace, targetPath).resolve(ARENA_DIR).resolve(VERSIONS_DIR);
        return garbageCollector.gc(versionsDir, limit <= 0 ? maxVersions : limit);
    }

    public boolean purge(String workspace, String namespace, String targetPath) throws SyncException {
        if (basePath == null) {
            return false;
        }
        Path targetRoot = targetRoot(workspace, namespace, targetPath);
        if (!Files.exists(targetRoot, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try {
            FileTrees.deleteRecursively(targetRoot);
        } catch (IOException e) {
            throw new SyncException("failed to purge " + targetPath + ": " + e.getMessage(), e);
        }
        log.info("content.purge workspace={} namespace={} target={}", workspace, namespace, targetPath);
        return true;
    }

    Path targetRoot(String workspace, String namespace, String targetPath) throws SyncException {
        Path root = basePath.resolve(workspace).resolve(namespace).resolve(normalizeTarget(targetPath)).normalize();
        if (!root.startsWith(basePath) || root.equals(basePath)) {
            throw new SyncException("target path escapes the content base: " + workspace + "/" + namespace + "/" + targetPath);
        }
        return root;
    }

    private void writeHead(Path targetRoot, String version) throws SyncException {
        Path arenaDir = targetRoot.resolve(ARENA_DIR);
        Path head = arenaDir.resolve(HEAD_FILE);
        Path tmp = arenaDir.resolve(HEAD_FILE + ".tmp");
        try {
            Files.createDirectories(arenaDir);
            Files.writeString(tmp, version, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, head, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, head, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new SyncException("failed to update HEAD to " + version + ": " + e.getMessage(), e);
        }
    }

    private void touch(Path versionDir) throws SyncException {
        try {
            Files.setLastModifiedTime(versionDir, FileTime.from(clock.instant()));
        } catch (IOException e) {
            throw new SyncException("failed to mark version " + versionDir.getFileName() + " as current: " + e.getMessage(), e);
        }
    }

    private static String normalizeTarget(String targetPath) {
        String normalized = targetPath == null ? "" : targetPath.strip().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
