package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ArenaTemplateSource {
    private SourceMetadata metadata;
    private ArenaTemplateSourceSpec spec;
    private ArenaTemplateSourceStatus status = new ArenaTemplateSourceStatus();

    public ArenaTemplateSource() {
    }

    public ArenaTemplateSource(SourceMetadata metadata, ArenaTemplateSourceSpec spec) {
        this.metadata = metadata;
        this.spec = spec;
    }

    public SourceMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(SourceMetadata metadata) {
        this.metadata = metadata;
    }

    public ArenaTemplateSourceSpec getSpec() {
        return spec;
    }

    public void setSpec(ArenaTemplateSourceSpec spec) {
        this.spec = spec;
    }

    public ArenaTemplateSourceStatus getStatus() {
        return status;
    }

    public void setStatus(ArenaTemplateSourceStatus status) {
        this.status = status == null ? new ArenaTemplateSourceStatus() : status;
    }

    public SourceKey key() {
        return metadata.key();
    }

    public String name() {
        return metadata.name();
    }

    public String namespace() {
        return metadata.namespace();
    }

    public long generation() {
        return metadata.generation();
    }

    public ArenaTemplateSource copy() {
        ArenaTemplateSource copy = new ArenaTemplateSource(metadata, spec);
        copy.status = status.copy();
        return copy;
    }
}
