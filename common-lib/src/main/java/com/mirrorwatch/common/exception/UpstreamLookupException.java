package com.mirrorwatch.common.exception;

/** The upstream repository could not be queried for its branch head or commit lineage. */
public class UpstreamLookupException extends ScannerException {

    public UpstreamLookupException(String message) {
        super(ErrorCategory.TRANSIENT_NETWORK, message);
    }

    public UpstreamLookupException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT_NETWORK, message, cause);
    }
}
