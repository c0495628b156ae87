package com.mirrorwatch.common.exception;

/** Timeout, refused or reset connection, TLS failure. Always recorded as unhealthy. */
public class TransientNetworkException extends ScannerException {

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT_NETWORK, message, cause);
    }

    public TransientNetworkException(ErrorCategory category, String message) {
        super(category, message);
    }
}
