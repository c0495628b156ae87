package com.mirrorwatch.common.model;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.exception.HttpStatusException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ProbeResultTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("latest version implies upstream")
    void latestRequiresUpstream() {
        ProbeResult result = new ProbeResult(1, NOW, true, 120, 200, "abcdef1", null,
            false, true, true, null, null);

        assertFalse(result.latestVersion());
        assertEquals(Connectivity.UNKNOWN, result.connectivity());
    }

    @Test
    @DisplayName("HTTP failure keeps status and truncates the body")
    void errorFromHttpException() {
        String body = "x".repeat(ProbeError.MAX_BODY_LENGTH + 10);
        ProbeError error = ProbeError.of(
            new HttpStatusException(ErrorCategory.HTTP_STATUS, 502, "Bad gateway", body), NOW);
        ProbeResult result = ProbeResult.failed(1, NOW, error);

        assertFalse(result.healthy());
        assertEquals(502, result.httpStatus());
        assertEquals(ProbeError.MAX_BODY_LENGTH, result.error().httpBody().length());
    }

    @Test
    @DisplayName("connectivity from address families")
    void connectivity() {
        assertEquals(Connectivity.ALL, Connectivity.of(true, true));
        assertEquals(Connectivity.IPV6, Connectivity.of(false, true));
        assertEquals(Connectivity.UNKNOWN, Connectivity.of(false, false));
    }

    @Test
    @DisplayName("freshness classes")
    void freshness() {
        assertEquals(VersionFreshness.MISSING, VersionFreshness.of(null, true, true));
        assertEquals(VersionFreshness.NON_UPSTREAM, VersionFreshness.of("abcdef1", false, false));
        assertEquals(VersionFreshness.OUTDATED_UPSTREAM, VersionFreshness.of("abcdef1", true, false));
        assertEquals(VersionFreshness.LATEST, VersionFreshness.of("abcdef1", true, true));
    }
}
