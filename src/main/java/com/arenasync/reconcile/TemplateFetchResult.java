package com.arenasync.reconcile;

import java.util.List;

import com.arenasync.fetch.Artifact;
import com.arenasync.source.SourceException;
import com.arenasync.template.Template;

/**
 * Outcome of one asynchronous fetch. {@code unchanged} results carry no artifact; their templates
 * are the ones already recorded for the source.
 */
public record TemplateFetchResult(Artifact artifact, List<Template> templates, SourceException error, boolean unchanged) {
    public TemplateFetchResult {
        templates = templates == null ? List.of() : List.copyOf(templates);
    }

    public static TemplateFetchResult success(Artifact artifact, List<Template> templates) {
        return new TemplateFetchResult(artifact, templates, null, false);
    }

    public static TemplateFetchResult unchanged(List<Template> templates) {
        return new TemplateFetchResult(null, templates, null, true);
    }

    public static TemplateFetchResult failure(Artifact artifact, SourceException error) {
        return new TemplateFetchResult(artifact, List.of(), error, false);
    }

    public boolean failed() {
        return error != null;
    }
}
