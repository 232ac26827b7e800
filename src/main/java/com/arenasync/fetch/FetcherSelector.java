package com.arenasync.fetch;

import com.arenasync.source.ArenaTemplateSourceSpec;
import com.arenasync.source.ConfigurationException;
import com.arenasync.source.SourceType;

import okhttp3.OkHttpClient;

/**
 * Builds the fetcher for a source spec. Selection only validates configuration; credentials and
 * remote state are touched later by the fetcher itself.
 */
public class FetcherSelector {
    private final CredentialLoader credentialLoader;
    private final ConfigStoreClient configStoreClient;
    private final GitCommandRunner gitCommandRunner;
    private final OkHttpClient httpClient;

    public FetcherSelector(
            CredentialLoader credentialLoader,
            ConfigStoreClient configStoreClient,
            GitCommandRunner gitCommandRunner,
            OkHttpClient httpClient) {
        this.credentialLoader = credentialLoader;
        this.configStoreClient = configStoreClient;
        this.gitCommandRunner = gitCommandRunner;
        this.httpClient = httpClient;
    }

    public Fetcher select(ArenaTemplateSourceSpec spec, String namespace, FetchOptions options) throws ConfigurationException {
        if (spec == null) {
            throw new ConfigurationException("source spec is missing");
        }
        SourceType type = SourceType.parse(spec.type())
                .orElseThrow(() -> new ConfigurationException("unsupported source type: " + spec.type()));
        switch (type) {
            case VERSION_CONTROL:
                if (spec.git() == null) {
                    throw new ConfigurationException("git configuration is required for git source type");
                }
                if (isBlank(spec.git().url())) {
                    throw new ConfigurationException("git url must not be blank");
                }
                return new GitFetcher(spec.git(), namespace, options, credentialLoader, gitCommandRunner);
            case REGISTRY:
                if (spec.oci() == null) {
                    throw new ConfigurationException("oci configuration is required for oci source type");
                }
                if (isBlank(spec.oci().url())) {
                    throw new ConfigurationException("oci url must not be blank");
                }
                return new RegistryFetcher(spec.oci(), namespace, options, credentialLoader, httpClient);
            case CONFIG_STORE:
                if (spec.configMap() == null) {
                    throw new ConfigurationException("configMap configuration is required for configmap source type");
                }
                if (isBlank(spec.configMap().name())) {
                    throw new ConfigurationException("configMap name must not be blank");
                }
                return new ConfigStoreFetcher(spec.configMap().name().strip(), namespace, options, configStoreClient);
            default:
                throw new ConfigurationException("unsupported source type: " + spec.type());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
