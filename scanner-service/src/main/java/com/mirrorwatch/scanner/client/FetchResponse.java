package com.mirrorwatch.scanner.client;

/**
 * Successful (2xx) response of an instance request.
 *
 * @param elapsedMs time from sending the request to having read the body
 */
public record FetchResponse(int status, String body, long elapsedMs) {}
