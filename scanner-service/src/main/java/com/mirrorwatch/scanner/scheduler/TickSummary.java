package com.mirrorwatch.scanner.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One probe tick.
 *
 * @param dispatched instances selected for probing
 * @param written    health check rows written; lower than {@code dispatched} when the tick deadline hit
 * @param crashed    probes that ended in a crash instead of a result
 * @param muted      unhealthy results whose error record was suppressed
 */
public record TickSummary(
    @JsonProperty("tickTime")   Instant tickTime,
    @JsonProperty("dispatched") int     dispatched,
    @JsonProperty("written")    int     written,
    @JsonProperty("healthy")    int     healthy,
    @JsonProperty("unhealthy")  int     unhealthy,
    @JsonProperty("crashed")    int     crashed,
    @JsonProperty("muted")      int     muted
) {}
