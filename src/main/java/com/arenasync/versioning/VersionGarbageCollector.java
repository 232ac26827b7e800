package com.arenasync.versioning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.fetch.FileTrees;

/**
 * Keeps at most {@code maxVersions} version directories, removing the least recently modified
 * ones first. Directory name breaks ties between equal modification times.
 */
public class VersionGarbageCollector {
    private static final Logger log = LoggerFactory.getLogger(VersionGarbageCollector.class);

    public static final int DEFAULT_MAX_VERSIONS = 10;

    public List<String> gc(Path versionsRoot, int maxVersions) throws SyncException {
        int limit = maxVersions <= 0 ? DEFAULT_MAX_VERSIONS : maxVersions;
        if (!Files.isDirectory(versionsRoot)) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        try (Stream<Path> children = Files.list(versionsRoot)) {
            for (Path child : children.toList()) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    candidates.add(new Candidate(child, Files.getLastModifiedTime(child, LinkOption.NOFOLLOW_LINKS)));
                }
            }
        } catch (IOException e) {
            throw new SyncException("failed to list versions in " + versionsRoot + ": " + e.getMessage(), e);
        }
        if (candidates.size() <= limit) {
            return List.of();
        }

        candidates.sort(Comparator.comparing(Candidate::modified)
                .thenComparing(candidate -> candidate.path().getFileName().toString()));
        List<Candidate> expired = candidates.subList(0, candidates.size() - limit);

        List<String> deleted = new ArrayList<>();
        SyncException failure = null;
        for (Candidate candidate : expired) {
            String name = candidate.path().getFileName().toString();
            try {
                FileTrees.deleteRecursively(candidate.path());
                deleted.add(name);
            } catch (IOException e) {
                if (failure == null) {
                    failure = new SyncException("failed to remove old version " + name + ": " + e.getMessage(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (!deleted.isEmpty()) {
            log.info("versions.gc root={} kept={} deleted={}", versionsRoot, limit, deleted);
        }
        if (failure != null) {
            throw failure;
        }
        return deleted;
    }

    private record Candidate(Path path, FileTime modified) {
    }
}
