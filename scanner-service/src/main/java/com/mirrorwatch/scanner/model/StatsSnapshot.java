package com.mirrorwatch.scanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("stats_snapshot")
public class StatsSnapshot {

    @Id
    private Long id;

    private Long instanceId;

    private LocalDateTime collectedAt;

    /** JSON-serialised {@code Map<String, Long>}, e.g. {@code {"accounts.total": 12}} */
    private String counters;
}
