package com.mirrorwatch.common.scoring;

import com.mirrorwatch.common.model.VersionFreshness;

import java.util.IntSummaryStatistics;
import java.util.Objects;

/**
 * Stateless calculator turning check history into an {@link InstanceScore}.
 *
 * <p><b>Formula</b>, with {@code p} the healthy fractions (an empty window counts as 0):
 * <pre>
 *   points = round(100 × p3h × (0.3·p3h + 0.2·p30d + 0.2·p120d + 0.1·v))
 *   v      = 1.0 latest, 0.5 upstream but outdated, 0.0 otherwise
 * </pre>
 * The leading {@code p3h} gates the score on the current state: an instance that has been
 * down for the last three hours scores 0 whatever its long-term record. All terms are
 * non-negative, so points never decrease when any window or the freshness improves.
 *
 * <p>Bad hosts get their points computed but {@code ranked=false}.
 *
 * <p>No reactive types. No logging.
 */
public final class InstanceScoreCalculator {

    static final double WEIGHT_3H        = 0.3;
    static final double WEIGHT_30D       = 0.2;
    static final double WEIGHT_120D      = 0.2;
    static final double WEIGHT_VERSION   = 0.1;
    static final double SCALE            = 100.0;

    static final double LATEST_VALUE     = 1.0;
    static final double OUTDATED_VALUE   = 0.5;

    private InstanceScoreCalculator() {}

    public static InstanceScore compute(ScoreInputs inputs) {
        // ── response times ──
        IntSummaryStatistics times = inputs.healthyResponseTimes().stream()
            .filter(Objects::nonNull)
            .mapToInt(Integer::intValue)
            .summaryStatistics();
        Integer avg = times.getCount() == 0 ? null : (int) Math.round(times.getAverage());
        Integer min = times.getCount() == 0 ? null : times.getMin();
        Integer max = times.getCount() == 0 ? null : times.getMax();

        // ── points ──
        double p3h   = inputs.last3h().fraction();
        double p30d  = inputs.last30d().fraction();
        double p120d = inputs.last120d().fraction();
        double v     = versionValue(inputs.freshness());

        double weighted = WEIGHT_3H * p3h + WEIGHT_30D * p30d + WEIGHT_120D * p120d + WEIGHT_VERSION * v;
        int points = (int) Math.round(SCALE * p3h * weighted);

        return new InstanceScore(
            inputs.healthyNow(),
            avg, min, max,
            inputs.last3h().percentage(),
            inputs.last30d().percentage(),
            inputs.last120d().percentage(),
            points,
            !inputs.badHost());
    }

    static double versionValue(VersionFreshness freshness) {
        return switch (freshness) {
            case LATEST            -> LATEST_VALUE;
            case OUTDATED_UPSTREAM -> OUTDATED_VALUE;
            case NON_UPSTREAM, MISSING -> 0.0;
        };
    }
}
