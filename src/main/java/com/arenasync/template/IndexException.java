package com.arenasync.template;

import com.arenasync.source.SourceException;

public class IndexException extends SourceException {
    public static final String REASON = "IndexError";

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
