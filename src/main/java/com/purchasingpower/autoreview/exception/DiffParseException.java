package com.purchasingpower.autoreview.exception;

import lombok.Getter;

/**
 * Raised inside the diff parser when the input is not a well-formed unified diff.
 * Never escapes {@link com.purchasingpower.autoreview.service.DiffParserService#parse(String)}.
 */
@Getter
public class DiffParseException extends RuntimeException {

    /**
     * 1-based line of the diff text that could not be parsed.
     */
    private final int lineNumber;

    public DiffParseException(String message, int lineNumber) {
        super(message + " (diff line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public DiffParseException(String message, int lineNumber, Throwable cause) {
        super(message + " (diff line " + lineNumber + ")", cause);
        this.lineNumber = lineNumber;
    }
}
