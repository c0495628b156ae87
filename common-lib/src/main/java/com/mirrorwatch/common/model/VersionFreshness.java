package com.mirrorwatch.common.model;

/**
 * Freshness class used by the scoring calculator.
 */
public enum VersionFreshness {
    LATEST,
    OUTDATED_UPSTREAM,
    NON_UPSTREAM,
    MISSING;

    public static VersionFreshness of(String versionName, Boolean upstream, Boolean latestVersion) {
        if (versionName == null || versionName.isBlank()) return MISSING;
        if (!Boolean.TRUE.equals(upstream))                return NON_UPSTREAM;
        return Boolean.TRUE.equals(latestVersion) ? LATEST : OUTDATED_UPSTREAM;
    }
}
