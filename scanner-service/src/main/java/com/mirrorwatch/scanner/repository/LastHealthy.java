package com.mirrorwatch.scanner.repository;

import java.time.LocalDateTime;

public record LastHealthy(Long instanceId, LocalDateTime lastHealthyAt) {}
