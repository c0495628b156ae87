package com.mirrorwatch.scanner.repository;

/** Healthy and total check counts of one instance, as aggregated by the store. */
public record WindowCount(Long instanceId, Long healthy, Long total) {}
