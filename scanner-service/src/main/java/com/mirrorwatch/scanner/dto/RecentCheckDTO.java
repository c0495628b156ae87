package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RecentCheckDTO(
    @JsonProperty("checkedAt")      Instant checkedAt,
    @JsonProperty("healthy")        boolean healthy,
    @JsonProperty("responseTimeMs") Integer responseTimeMs,
    @JsonProperty("httpStatus")     Integer httpStatus
) {}
