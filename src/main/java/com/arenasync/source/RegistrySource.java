package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistrySource(String url, boolean insecure, SecretReference secretRef) {
    public RegistrySource {
        url = url == null ? "" : url.strip();
    }
}
