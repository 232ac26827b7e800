package com.arenasync.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Content hash of a directory tree. Entries are visited in sorted relative-path order and only
 * names, file bytes and link targets contribute, so copies of a tree hash identically.
 */
public final class DirectoryHasher {
    private static final byte[] SEPARATOR = {0};

    private DirectoryHasher() {
    }

    public static String hash(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(root.toString());
        }
        MessageDigest digest = sha256();
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            entries = walk.filter(path -> !path.equals(root))
                    .sorted((left, right) -> relative(root, left).compareTo(relative(root, right)))
                    .toList();
        }
        byte[] buffer = new byte[8192];
        for (Path entry : entries) {
            String name = relative(root, entry);
            if (Files.isSymbolicLink(entry)) {
                update(digest, name + "->" + Files.readSymbolicLink(entry).toString().replace('\\', '/'));
                digest.update(SEPARATOR);
            } else if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                update(digest, name + "/");
                digest.update(SEPARATOR);
            } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                update(digest, name);
                digest.update(SEPARATOR);
                try (InputStream in = Files.newInputStream(entry)) {
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        digest.update(buffer, 0, read);
                    }
                }
                digest.update(SEPARATOR);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static String relative(Path root, Path entry) {
        return root.relativize(entry).toString().replace('\\', '/');
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
