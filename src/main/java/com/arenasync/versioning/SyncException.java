package com.arenasync.versioning;

import com.arenasync.source.SourceException;

public class SyncException extends SourceException {
    public static final String REASON = "SyncError";

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
