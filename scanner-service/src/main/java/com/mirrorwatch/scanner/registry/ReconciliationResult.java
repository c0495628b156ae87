package com.mirrorwatch.scanner.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Domains touched by one registry pass. {@code retired} is the part of
 * {@code removedCandidates} that this pass disabled.
 */
public record ReconciliationResult(
    @JsonProperty("added")             List<String> added,
    @JsonProperty("retained")          List<String> retained,
    @JsonProperty("removedCandidates") List<String> removedCandidates,
    @JsonProperty("reactivated")       List<String> reactivated,
    @JsonProperty("retired")           List<String> retired
) {}
