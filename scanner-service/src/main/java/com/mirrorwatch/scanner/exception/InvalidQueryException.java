package com.mirrorwatch.scanner.exception;

/** Rejected query parameters, e.g. a time range whose start lies after its end. */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
