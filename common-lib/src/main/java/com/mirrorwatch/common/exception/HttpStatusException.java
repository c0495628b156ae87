package com.mirrorwatch.common.exception;

/**
 * Non-2xx answer from a probed host.
 *
 * <p>{@code body} is {@code null} for well-known statuses (404, gateway and
 * CDN errors, recognised block pages) so their bodies are not stored.
 * {@code elapsedMs} is the time until the response was read, {@code null} when unknown.
 */
public class HttpStatusException extends ScannerException {
    private final int status;
    private final String body;
    private final Long elapsedMs;

    public HttpStatusException(ErrorCategory category, int status, String message, String body) {
        this(category, status, message, body, null);
    }

    public HttpStatusException(ErrorCategory category, int status, String message, String body, Long elapsedMs) {
        super(category, message);
        this.status    = status;
        this.body      = body;
        this.elapsedMs = elapsedMs;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public Long getElapsedMs() {
        return elapsedMs;
    }
}
