package com.mirrorwatch.common.exception;

/**
 * Failure categories recorded on unhealthy checks and error records.
 *
 * <p>{@link #isTransient()} marks categories caused by the network path rather
 * than by what the instance served.
 */
public enum ErrorCategory {
    TRANSIENT_NETWORK,
    TIMEOUT,
    HTTP_STATUS,
    CAPTCHA,
    BLOCKED,
    RATE_LIMITED,
    CONTENT_MISMATCH,
    PARSE,
    INVALID_URL,
    INTERNAL;

    public boolean isTransient() {
        return this == TRANSIENT_NETWORK || this == TIMEOUT;
    }
}
