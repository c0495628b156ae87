package com.mirrorwatch.scanner.exception;

public class InstanceNotFoundException extends RuntimeException {

    public InstanceNotFoundException(String domain) {
        super("Unknown instance: " + domain);
    }
}
