package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CounterSummaryDTO(
    @JsonProperty("min") long   min,
    @JsonProperty("avg") double avg,
    @JsonProperty("max") long   max
) {}
