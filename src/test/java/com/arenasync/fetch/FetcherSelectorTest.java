package com.arenasync.fetch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.arenasync.source.ArenaTemplateSourceSpec;
import com.arenasync.source.ConfigStoreSource;
import com.arenasync.source.ConfigurationException;
import com.arenasync.source.GitReference;
import com.arenasync.source.RegistrySource;
import com.arenasync.source.SourceType;
import com.arenasync.source.VersionControlSource;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FetcherSelectorTest {

    @TempDir
    Path tempDir;

    private final FetcherSelector selector = new FetcherSelector(
            new CredentialLoader((namespace, name) -> Optional.empty()),
            (namespace, name) -> Optional.empty(),
            new GitCommandRunner(Duration.ofSeconds(1)),
            new OkHttpClient());

    @Test
    void shouldSelectFetcherForEachSourceType() throws Exception {
        Fetcher git = selector.select(spec("git", new VersionControlSource("https://example.com/arena.git",
                new GitReference("main", null, null), null, null), null, null), "team", options());
        Fetcher oci = selector.select(spec("oci", null, new RegistrySource("oci://ghcr.io/arena/templates:v1", false, null), null),
                "team", options());
        Fetcher configMap = selector.select(ArenaTemplateSourceSpec.configStore("catalog"), "team", options());

        assertInstanceOf(GitFetcher.class, git);
        assertEquals(SourceType.VERSION_CONTROL, git.type());
        assertInstanceOf(RegistryFetcher.class, oci);
        assertEquals(SourceType.REGISTRY, oci.type());
        assertInstanceOf(ConfigStoreFetcher.class, configMap);
        assertEquals(SourceType.CONFIG_STORE, configMap.type());
    }

    @Test
    void shouldRejectUnknownOrIncompleteSources() {
        assertThrows(ConfigurationException.class,
                () -> selector.select(spec("svn", null, null, null), "team", options()));
        assertThrows(ConfigurationException.class,
                () -> selector.select(spec("", null, null, null), "team", options()));
        assertThrows(ConfigurationException.class,
                () -> selector.select(spec("git", null, null, null), "team", options()));
        assertThrows(ConfigurationException.class,
                () -> selector.select(spec("oci", null, new RegistrySource(" ", false, null), null), "team", options()));
        ConfigurationException blankName = assertThrows(ConfigurationException.class,
                () -> selector.select(spec("configmap", null, null, new ConfigStoreSource(" ")), "team", options()));
        assertEquals("ConfigurationError", blankName.reason());
    }

    private FetchOptions options() {
        return new FetchOptions(tempDir, Duration.ofSeconds(5));
    }

    private static ArenaTemplateSourceSpec spec(String type, VersionControlSource git, RegistrySource oci, ConfigStoreSource configMap) {
        return new ArenaTemplateSourceSpec(type, git, oci, configMap, null, false, null, null);
    }
}
