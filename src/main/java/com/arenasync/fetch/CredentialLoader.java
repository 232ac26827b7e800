package com.arenasync.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.arenasync.source.SecretReference;

public class CredentialLoader {
    private final SecretStore secretStore;

    public CredentialLoader(SecretStore secretStore) {
        this.secretStore = secretStore;
    }

    public GitCredentials loadGitCredentials(String namespace, SecretReference reference) throws FetchException {
        if (reference == null || reference.name() == null || reference.name().isBlank()) {
            return GitCredentials.none();
        }
        Map<String, byte[]> data = load(namespace, reference.name());
        byte[] privateKey = data.containsKey("ssh-privatekey") ? data.get("ssh-privatekey") : data.get("identity");
        return new GitCredentials(
                text(data, "username"),
                text(data, "password"),
                privateKey,
                text(data, "ssh-privatekey-password"),
                data.get("known_hosts"));
    }

    public RegistryCredentials loadRegistryCredentials(String namespace, SecretReference reference) throws FetchException {
        if (reference == null || reference.name() == null || reference.name().isBlank()) {
            return RegistryCredentials.none();
        }
        Map<String, byte[]> data = load(namespace, reference.name());
        return new RegistryCredentials(text(data, "username"), text(data, "password"), data.get(".dockerconfigjson"));
    }

    private Map<String, byte[]> load(String namespace, String name) throws FetchException {
        try {
            return secretStore.get(namespace, name)
                    .orElseThrow(() -> new FetchException("secret " + namespace + "/" + name + " not found"));
        } catch (IOException e) {
            throw new FetchException("failed to read secret " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }

    private static String text(Map<String, byte[]> data, String key) {
        byte[] value = data.get(key);
        return value == null ? "" : new String(value, StandardCharsets.UTF_8);
    }
}
