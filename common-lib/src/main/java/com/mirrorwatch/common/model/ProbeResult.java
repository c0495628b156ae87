package com.mirrorwatch.common.model;

import java.time.Instant;

/**
 * Immutable outcome of one probe of one instance during one scheduler tick.
 *
 * <ul>
 *   <li>{@code responseTimeMs} – elapsed time of the profile request; {@code null}
 *       when no HTTP response was received.</li>
 *   <li>{@code upstream} / {@code latestVersion} – derived from the about page and the
 *       upstream oracle; {@code latestVersion} implies {@code upstream}.</li>
 *   <li>{@code error} – present exactly when {@code healthy} is false.</li>
 * </ul>
 */
public record ProbeResult(
    long         instanceId,
    Instant      checkedAt,
    boolean      healthy,
    Integer      responseTimeMs,
    Integer      httpStatus,
    String       versionName,
    String       versionUrl,
    boolean      upstream,
    boolean      latestVersion,
    boolean      rss,
    Connectivity connectivity,
    ProbeError   error
) {

    public ProbeResult {
        if (!upstream) {
            latestVersion = false;
        }
        if (connectivity == null) {
            connectivity = Connectivity.UNKNOWN;
        }
    }

    /** Result for a probe that produced nothing but an error. */
    public static ProbeResult failed(long instanceId, Instant checkedAt, ProbeError error) {
        return new ProbeResult(instanceId, checkedAt, false, null, error.httpStatus(),
            null, null, false, false, false, Connectivity.UNKNOWN, error);
    }
}
