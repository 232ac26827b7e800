package com.arenasync.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.source.SourceType;

/**
 * Materializes a config-store entry as a directory: one file per key, with {@code __} in a key
 * standing for a path separator.
 */
public class ConfigStoreFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(ConfigStoreFetcher.class);

    private final String name;
    private final String namespace;
    private final FetchOptions options;
    private final ConfigStoreClient client;
    private final Clock clock;

    public ConfigStoreFetcher(String name, String namespace, FetchOptions options, ConfigStoreClient client) {
        this(name, namespace, options, client, Clock.systemUTC());
    }

    ConfigStoreFetcher(String name, String namespace, FetchOptions options, ConfigStoreClient client, Clock clock) {
        this.name = name;
        this.namespace = namespace;
        this.options = options;
        this.client = client;
        this.clock = clock;
    }

    @Override
    public SourceType type() {
        return SourceType.CONFIG_STORE;
    }

    @Override
    public String latestRevision(FetchContext context) throws FetchException {
        context.checkCanceled();
        return load().resourceVersion();
    }

    @Override
    public Artifact fetch(FetchContext context, String revision) throws FetchException {
        context.checkCanceled();
        ConfigEntry entry = load();
        if (revision != null && !revision.isBlank() && !revision.equals(entry.resourceVersion())) {
            throw new FetchException("revision mismatch: expected " + revision + ", got " + entry.resourceVersion());
        }

        Map<String, byte[]> files = new LinkedHashMap<>(entry.binaryData());
        entry.data().forEach((key, value) -> files.put(key, value.getBytes(StandardCharsets.UTF_8)));

        Path output;
        try {
            Files.createDirectories(options.workDir());
            output = Files.createTempDirectory(options.workDir(), "artifact-");
        } catch (IOException e) {
            throw new FetchException("failed to create output directory: " + e.getMessage(), e);
        }
        try {
            for (Map.Entry<String, byte[]> file : files.entrySet()) {
                Path target = resolveKey(output, file.getKey());
                if (target == null) {
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.write(target, file.getValue());
            }
            String checksum = "sha256:" + DirectoryHasher.hash(output);
            long size = FileTrees.size(output);
            log.info("configstore.fetch.complete namespace={} name={} revision={} files={}",
                    namespace, name, entry.resourceVersion(), files.size());
            return new Artifact(output, checksum, entry.resourceVersion(), size, clock.instant());
        } catch (IOException e) {
            deleteQuietly(output, e);
            throw new FetchException("failed to write config entry " + namespace + "/" + name + ": " + e.getMessage(), e);
        } catch (FetchException | RuntimeException e) {
            deleteQuietly(output, e);
            throw e;
        }
    }

    static String decodeKey(String key) {
        return key.replace("__", "/");
    }

    private static Path resolveKey(Path output, String key) throws FetchException {
        String decoded = decodeKey(key);
        if (decoded.isEmpty() || decoded.endsWith("/")) {
            return null;
        }
        Path target = output.resolve(decoded).normalize();
        if (!target.startsWith(output) || target.equals(output)) {
            throw new FetchException("config key \"" + key + "\" escapes the artifact directory");
        }
        return target;
    }

    private ConfigEntry load() throws FetchException {
        try {
            return client.get(namespace, name)
                    .orElseThrow(() -> new FetchException("failed to get config entry " + namespace + "/" + name + ": not found"));
        } catch (IOException e) {
            throw new FetchException("failed to get config entry " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path path, Exception primary) {
        try {
            FileTrees.deleteRecursively(path);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }
}
