package com.mirrorwatch.common.scoring;

import com.mirrorwatch.common.model.VersionFreshness;

import java.util.List;

/**
 * Everything {@link InstanceScoreCalculator} needs about one instance.
 *
 * @param healthyNow            latest check was healthy
 * @param last3h                counts over the last 3 hours
 * @param last30d               counts over the last 30 days
 * @param last120d              counts over the last 120 days
 * @param healthyResponseTimes  response times of healthy checks inside the ping range; may contain nulls
 * @param freshness             freshness of the latest reported version
 * @param badHost               known to block checks; scored but never ranked
 */
public record ScoreInputs(
    boolean          healthyNow,
    WindowStats      last3h,
    WindowStats      last30d,
    WindowStats      last120d,
    List<Integer>    healthyResponseTimes,
    VersionFreshness freshness,
    boolean          badHost
) {

    public ScoreInputs {
        last3h   = last3h   == null ? WindowStats.EMPTY : last3h;
        last30d  = last30d  == null ? WindowStats.EMPTY : last30d;
        last120d = last120d == null ? WindowStats.EMPTY : last120d;
        healthyResponseTimes = healthyResponseTimes == null ? List.of() : healthyResponseTimes;
        freshness = freshness == null ? VersionFreshness.MISSING : freshness;
    }
}
