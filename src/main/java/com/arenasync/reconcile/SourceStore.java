package com.arenasync.reconcile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.arenasync.source.ArenaTemplateSource;
import com.arenasync.source.SourceKey;

/**
 * Desired state of template sources plus the status the engine records for them.
 */
public interface SourceStore {
    List<SourceKey> list() throws IOException;

    Optional<ArenaTemplateSource> get(SourceKey key) throws IOException;

    void updateStatus(ArenaTemplateSource source) throws IOException;

    void deleteStatus(SourceKey key) throws IOException;
}
