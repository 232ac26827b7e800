package com.arenasync.source;

public class ConfigurationException extends SourceException {
    public static final String REASON = "ConfigurationError";

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
