package com.mirrorwatch.scanner.repository;

import java.time.LocalDateTime;

/** Checks of one tick aggregated across the selected instances. */
public record HistoryPoint(LocalDateTime time, Long healthy, Long total, Double avgResponseMs) {}
