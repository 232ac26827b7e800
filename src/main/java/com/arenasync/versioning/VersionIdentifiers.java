package com.arenasync.versioning;

import java.io.IOException;

import com.arenasync.fetch.Artifact;
import com.arenasync.fetch.DirectoryHasher;

public final class VersionIdentifiers {
    public static final int VERSION_LENGTH = 12;
    private static final String SHA256_PREFIX = "sha256:";

    private VersionIdentifiers() {
    }

    /**
     * Derives the version directory name for an artifact: the first twelve characters of its
     * sha256 checksum, or of a fresh directory hash when the checksum is not usable.
     */
    public static String computeVersion(Artifact artifact) throws SyncException {
        String checksum = artifact.checksum();
        if (checksum.startsWith(SHA256_PREFIX) && checksum.length() - SHA256_PREFIX.length() >= VERSION_LENGTH) {
            return checksum.substring(SHA256_PREFIX.length(), SHA256_PREFIX.length() + VERSION_LENGTH);
        }
        try {
            return DirectoryHasher.hash(artifact.path()).substring(0, VERSION_LENGTH);
        } catch (IOException e) {
            throw new SyncException("failed to calculate content hash of " + artifact.path() + ": " + e.getMessage(), e);
        }
    }
}
