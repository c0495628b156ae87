package com.mirrorwatch.scanner.retention;

public record CleanupSummary(int errorRecordsEvicted, int healthChecksDeleted) {}
