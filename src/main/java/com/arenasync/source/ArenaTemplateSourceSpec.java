package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArenaTemplateSourceSpec(
        String type,
        VersionControlSource git,
        RegistrySource oci,
        @JsonProperty("configMap") ConfigStoreSource configMap,
        String syncInterval,
        boolean suspend,
        String timeout,
        String templatesPath) {
    public static final String DEFAULT_SYNC_INTERVAL = "1h";
    public static final String DEFAULT_TIMEOUT = "60s";
    public static final String DEFAULT_TEMPLATES_PATH = "templates";

    public ArenaTemplateSourceSpec {
        type = type == null ? "" : type.strip();
        syncInterval = syncInterval == null || syncInterval.isBlank() ? DEFAULT_SYNC_INTERVAL : syncInterval.strip();
        timeout = timeout == null || timeout.isBlank() ? DEFAULT_TIMEOUT : timeout.strip();
        templatesPath = templatesPath == null || templatesPath.isBlank() ? DEFAULT_TEMPLATES_PATH : templatesPath.strip();
    }

    public static ArenaTemplateSourceSpec configStore(String configName) {
        return new ArenaTemplateSourceSpec("configmap", null, null, new ConfigStoreSource(configName), null, false, null, null);
    }

    public ArenaTemplateSourceSpec withSuspend(boolean value) {
        return new ArenaTemplateSourceSpec(type, git, oci, configMap, syncInterval, value, timeout, templatesPath);
    }

    public ArenaTemplateSourceSpec withSyncInterval(String value) {
        return new ArenaTemplateSourceSpec(type, git, oci, configMap, value, suspend, timeout, templatesPath);
    }

    public ArenaTemplateSourceSpec withTimeout(String value) {
        return new ArenaTemplateSourceSpec(type, git, oci, configMap, syncInterval, suspend, value, templatesPath);
    }
}
