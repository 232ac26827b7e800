package com.arenasync.fetch;

import java.util.List;

/**
 * A parsed {@code oci://host/repository[:tag][@digest]} reference. References without an explicit
 * registry host resolve to Docker Hub.
 */
public record RegistryReference(String registry, String repository, String tag, String digest) {
    static final String DOCKER_HUB = "registry-1.docker.io";
    static final String DEFAULT_TAG = "latest";

    public static RegistryReference parse(String url) throws FetchException {
        if (url == null || url.isBlank()) {
            throw new FetchException("registry url must not be blank");
        }
        String rest = url.strip();
        if (rest.startsWith("oci://")) {
            rest = rest.substring("oci://".length());
        }
        String digest = "";
        int at = rest.indexOf('@');
        if (at >= 0) {
            digest = rest.substring(at + 1);
            rest = rest.substring(0, at);
            if (!digest.matches("[a-z0-9]+:[a-fA-F0-9]{32,}")) {
                throw new FetchException("failed to parse OCI reference \"" + url + "\": invalid digest " + digest);
            }
        }

        String registry = DOCKER_HUB;
        int slash = rest.indexOf('/');
        if (slash > 0) {
            String candidate = rest.substring(0, slash);
            if (candidate.contains(".") || candidate.contains(":") || candidate.equals("localhost")) {
                registry = candidate;
                rest = rest.substring(slash + 1);
            }
        }

        String tag = "";
        int lastSlash = rest.lastIndexOf('/');
        int colon = rest.lastIndexOf(':');
        if (colon > lastSlash) {
            tag = rest.substring(colon + 1);
            rest = rest.substring(0, colon);
        }
        if (tag.isEmpty() && digest.isEmpty()) {
            tag = DEFAULT_TAG;
        }
        if (rest.isEmpty() || !rest.matches("[a-z0-9]+([._/-][a-z0-9]+)*")) {
            throw new FetchException("failed to parse OCI reference \"" + url + "\": invalid repository");
        }
        if (registry.equals(DOCKER_HUB) && !rest.contains("/")) {
            rest = "library/" + rest;
        }
        return new RegistryReference(registry, rest, tag, digest);
    }

    public boolean pinnedByDigest() {
        return !digest.isEmpty();
    }

    /**
     * The tag or digest used to address the manifest.
     */
    public String reference() {
        return pinnedByDigest() ? digest : tag;
    }

    List<String> credentialHosts() {
        if (registry.equals(DOCKER_HUB)) {
            return List.of("https://index.docker.io/v1/", "index.docker.io", "docker.io", DOCKER_HUB);
        }
        return List.of(registry, "https://" + registry, "http://" + registry);
    }
}
