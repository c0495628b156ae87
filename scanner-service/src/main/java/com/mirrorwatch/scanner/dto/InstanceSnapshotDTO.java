package com.mirrorwatch.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.common.scoring.InstanceScore;

import java.time.Instant;
import java.util.List;

/**
 * Everything the status page shows about one instance.
 *
 * <p>{@code stale} marks hosts missing from the registry listing that are still enabled.
 * {@code showLastSeen} is set when no healthy check happened in the last 12 hours.
 */
public record InstanceSnapshotDTO(
    @JsonProperty("domain")        String  domain,
    @JsonProperty("url")           String  url,
    @JsonProperty("country")       String  country,
    @JsonProperty("additional")    boolean additional,
    @JsonProperty("badHost")       boolean badHost,
    @JsonProperty("stale")         boolean stale,

    // ── score ────────────────────────────────────────────────────────────────
    @JsonProperty("score")         InstanceScore score,
    @JsonProperty("overallPct")    Double  overallPct,
    @JsonProperty("lastHealthyAt") Instant lastHealthyAt,
    @JsonProperty("showLastSeen")  boolean showLastSeen,

    // ── latest check ─────────────────────────────────────────────────────────
    @JsonProperty("lastCheckedAt") Instant      lastCheckedAt,
    @JsonProperty("rss")           boolean      rss,
    @JsonProperty("versionName")   String       versionName,
    @JsonProperty("versionUrl")    String       versionUrl,
    @JsonProperty("upstream")      boolean      upstream,
    @JsonProperty("latestVersion") boolean      latestVersion,
    @JsonProperty("connectivity")  Connectivity connectivity,

    @JsonProperty("recentChecks")  List<RecentCheckDTO> recentChecks
) {}
