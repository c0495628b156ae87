package com.mirrorwatch.common.exception;

/** Registry, profile or about page markup did not have the expected structure. */
public class MarkupParseException extends ScannerException {

    public MarkupParseException(String message) {
        super(ErrorCategory.PARSE, message);
    }
}
