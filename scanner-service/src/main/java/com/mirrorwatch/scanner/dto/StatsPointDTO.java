package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/** Counters of one collection run, summarised across the selected instances. */
public record StatsPointDTO(
    @JsonProperty("time")      Instant time,
    @JsonProperty("instances") int     instances,
    @JsonProperty("counters")  Map<String, CounterSummaryDTO> counters
) {}
