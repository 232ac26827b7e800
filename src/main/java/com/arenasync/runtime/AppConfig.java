package com.arenasync.runtime;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EngineConfig engine = new EngineConfig();
    private StoresConfig stores = new StoresConfig();
    private Map<String, String> workspaces = new HashMap<>();

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine == null ? new EngineConfig() : engine;
    }

    public StoresConfig getStores() {
        return stores;
    }

    public void setStores(StoresConfig stores) {
        this.stores = stores == null ? new StoresConfig() : stores;
    }

    public Map<String, String> getWorkspaces() {
        return workspaces;
    }

    public void setWorkspaces(Map<String, String> workspaces) {
        this.workspaces = workspaces == null ? new HashMap<>() : workspaces;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EngineConfig {
        private String workspaceContentPath = ".arena-sync/content";
        private int maxVersionsPerSource = 10;
        private int workers = 2;
        private long fetchPollIntervalMs = 5000;
        private long indexRetryDelayMs = 30000;
        private long retryBaseDelayMs = 1000;
        private long retryMaxDelayMs = 60000;
        private String workDir = "";
        private long gitTimeoutMs = 60000;

        public String getWorkspaceContentPath() {
            return workspaceContentPath;
        }

        public void setWorkspaceContentPath(String workspaceContentPath) {
            this.workspaceContentPath = workspaceContentPath;
        }

        public int getMaxVersionsPerSource() {
            return maxVersionsPerSource;
        }

        public void setMaxVersionsPerSource(int maxVersionsPerSource) {
            this.maxVersionsPerSource = maxVersionsPerSource;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getFetchPollIntervalMs() {
            return fetchPollIntervalMs;
        }

        public void setFetchPollIntervalMs(long fetchPollIntervalMs) {
            this.fetchPollIntervalMs = fetchPollIntervalMs;
        }

        public long getIndexRetryDelayMs() {
            return indexRetryDelayMs;
        }

        public void setIndexRetryDelayMs(long indexRetryDelayMs) {
            this.indexRetryDelayMs = indexRetryDelayMs;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public long getGitTimeoutMs() {
            return gitTimeoutMs;
        }

        public void setGitTimeoutMs(long gitTimeoutMs) {
            this.gitTimeoutMs = gitTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoresConfig {
        private String sourcesPath = "sources";
        private String statusPath = ".arena-sync/status";
        private String configStorePath = "config-store";
        private String secretStorePath = "secrets";
        private String eventLogPath = ".arena-sync/events.jsonl";

        public String getSourcesPath() {
            return sourcesPath;
        }

        public void setSourcesPath(String sourcesPath) {
            this.sourcesPath = sourcesPath;
        }

        public String getStatusPath() {
            return statusPath;
        }

        public void setStatusPath(String statusPath) {
            this.statusPath = statusPath;
        }

        public String getConfigStorePath() {
            return configStorePath;
        }

        public void setConfigStorePath(String configStorePath) {
            this.configStorePath = configStorePath;
        }

        public String getSecretStorePath() {
            return secretStorePath;
        }

        public void setSecretStorePath(String secretStorePath) {
            this.secretStorePath = secretStorePath;
        }

        public String getEventLogPath() {
            return eventLogPath;
        }

        public void setEventLogPath(String eventLogPath) {
            this.eventLogPath = eventLogPath;
        }
    }
}
