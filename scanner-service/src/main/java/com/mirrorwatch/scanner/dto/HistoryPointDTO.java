package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Health of the selected instances at one tick. */
public record HistoryPointDTO(
    @JsonProperty("time")              Instant time,
    @JsonProperty("healthy")           long    healthy,
    @JsonProperty("total")             long    total,
    @JsonProperty("healthyPercentage") double  healthyPercentage,
    @JsonProperty("avgResponseMs")     Double  avgResponseMs
) {}
