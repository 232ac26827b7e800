package com.arenasync.fetch;

import com.arenasync.source.SourceType;

/**
 * Retrieves content for one configured source. Implementations load their credentials lazily
 * so that constructing a fetcher never performs I/O.
 */
public interface Fetcher {
    SourceType type();

    /**
     * Returns the newest upstream revision in the form {@link #fetch} accepts.
     */
    String latestRevision(FetchContext context) throws FetchException;

    Artifact fetch(FetchContext context, String revision) throws FetchException;

    /**
     * Maps a raw revision to the label recorded on fetched artifacts, so an unchanged upstream
     * can be recognised without fetching.
     */
    default String revisionLabel(String revision) {
        return revision;
    }
}
