package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ErrorRecordDTO(
    @JsonProperty("occurredAt") Instant occurredAt,
    @JsonProperty("category")   String  category,
    @JsonProperty("message")    String  message,
    @JsonProperty("httpStatus") Integer httpStatus,
    @JsonProperty("httpBody")   String  httpBody
) {}
