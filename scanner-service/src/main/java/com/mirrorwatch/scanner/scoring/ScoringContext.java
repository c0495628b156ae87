package com.mirrorwatch.scanner.scoring;

import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.repository.WindowCount;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Check history of all instances as of {@code now}, loaded once per scoring pass.
 * All maps are keyed by instance id; instances without checks have no entry.
 */
public record ScoringContext(
    Instant                         now,
    Map<Long, WindowCount>          last3h,
    Map<Long, WindowCount>          last30d,
    Map<Long, WindowCount>          last120d,
    Map<Long, WindowCount>          overall,
    Map<Long, LocalDateTime>        lastHealthy,
    Map<Long, List<Integer>>        healthyResponseTimes,
    Map<Long, HealthCheckRecord>    latest
) {}
