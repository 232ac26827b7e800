package com.arenasync.fetch;

import com.arenasync.source.SourceException;

public class FetchException extends SourceException {
    public static final String REASON = "FetchError";

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
