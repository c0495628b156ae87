package com.mirrorwatch.common.exception;

/** The host answered, but the expected marker or content was absent. */
public class ContentMismatchException extends ScannerException {

    public ContentMismatchException(String message) {
        super(ErrorCategory.CONTENT_MISMATCH, message);
    }
}
