package com.mirrorwatch.common.registry;

/**
 * Persisted view of an instance as the reconciliation planner sees it.
 * {@code id} is {@code null} only for rows that have not been stored yet.
 */
public record KnownInstance(
    Long    id,
    String  domain,
    String  url,
    String  country,
    boolean additional,
    boolean badHost,
    boolean enabled,
    int     missedPasses
) {}
