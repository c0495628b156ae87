package com.mirrorwatch.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived score of one instance. Percentages are {@code null} when the window has no checks.
 */
public record InstanceScore(
    @JsonProperty("healthyNow")    boolean healthyNow,
    @JsonProperty("avgResponseMs") Integer avgResponseMs,
    @JsonProperty("minResponseMs") Integer minResponseMs,
    @JsonProperty("maxResponseMs") Integer maxResponseMs,
    @JsonProperty("pct3h")         Double  pct3h,
    @JsonProperty("pct30d")        Double  pct30d,
    @JsonProperty("pct120d")       Double  pct120d,
    @JsonProperty("points")        int     points,
    @JsonProperty("ranked")        boolean ranked
) {}
