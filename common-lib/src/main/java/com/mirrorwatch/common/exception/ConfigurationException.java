package com.mirrorwatch.common.exception;

/** Invalid startup configuration. Only ever thrown while the process boots. */
public class ConfigurationException extends ScannerException {

    public ConfigurationException(String message) {
        super(ErrorCategory.INTERNAL, message);
    }
}
