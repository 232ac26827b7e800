package com.arenasync.source;

/**
 * Base of the failures a template source can surface in its status. Each subtype maps to one
 * stable condition reason.
 */
public abstract class SourceException extends Exception {
    protected SourceException(String message) {
        super(message);
    }

    protected SourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reason();
}
