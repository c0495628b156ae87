package com.mirrorwatch.common.exception;

public class ScannerException extends RuntimeException {
    private final ErrorCategory category;

    public ScannerException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ScannerException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
