package com.arenasync.template;

import com.arenasync.source.SourceException;

public class TemplateParseException extends SourceException {
    public static final String REASON = "ParseError";

    public TemplateParseException(String message) {
        super(message);
    }

    public TemplateParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
