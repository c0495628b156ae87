package com.mirrorwatch.common.exception;

public class RegistryFetchException extends ScannerException {

    public RegistryFetchException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT_NETWORK, message, cause);
    }
}
