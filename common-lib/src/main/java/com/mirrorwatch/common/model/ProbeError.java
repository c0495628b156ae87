package com.mirrorwatch.common.model;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.exception.HttpStatusException;
import com.mirrorwatch.common.exception.ScannerException;

import java.time.Instant;

/**
 * Failure detail attached to an unhealthy {@link ProbeResult}.
 * Bodies are truncated to {@link #MAX_BODY_LENGTH}, messages to {@link #MAX_MESSAGE_LENGTH}.
 */
public record ProbeError(
    ErrorCategory category,
    String        message,
    Integer       httpStatus,
    String        httpBody,
    Instant       occurredAt
) {

    public static final int MAX_MESSAGE_LENGTH = 512;
    public static final int MAX_BODY_LENGTH    = 4096;

    public ProbeError {
        message  = truncate(message, MAX_MESSAGE_LENGTH);
        httpBody = truncate(httpBody, MAX_BODY_LENGTH);
    }

    public static ProbeError of(ScannerException e, Instant occurredAt) {
        if (e instanceof HttpStatusException http) {
            return new ProbeError(http.getCategory(), http.getMessage(), http.getStatus(), http.getBody(), occurredAt);
        }
        return new ProbeError(e.getCategory(), e.getMessage(), null, null, occurredAt);
    }

    public static ProbeError of(ErrorCategory category, String message, Instant occurredAt) {
        return new ProbeError(category, message, null, null, occurredAt);
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
