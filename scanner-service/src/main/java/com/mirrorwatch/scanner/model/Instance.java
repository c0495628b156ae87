package com.mirrorwatch.scanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A monitored public instance. Rows are never deleted; {@code enabled=false} retires a host.
 *
 * Column mapping (R2DBC snake_case convention):
 *   badHost      → bad_host
 *   missedPasses → missed_passes
 *   listedSince  → listed_since
 *   updatedAt    → updated_at
 */
@Data
@NoArgsConstructor
@Table("instance")
public class Instance {

    @Id
    private Long id;

    /** Normalized host name, unique. */
    private String domain;

    /** Base URL: scheme and host, no trailing slash. */
    private String url;

    private String country;

    private boolean additional;

    private boolean badHost;

    private boolean enabled;

    /** Consecutive registry passes this domain was not listed. */
    private int missedPasses;

    /** Start of the current listing streak: insert time or the pass that listed it again. */
    private LocalDateTime listedSince;

    private LocalDateTime updatedAt;
}
