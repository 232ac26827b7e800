package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionControlSource(String url, GitReference ref, String path, SecretReference secretRef) {
    public VersionControlSource {
        url = url == null ? "" : url.strip();
        ref = ref == null ? GitReference.none() : ref;
        path = path == null ? "" : path.strip();
    }
}
