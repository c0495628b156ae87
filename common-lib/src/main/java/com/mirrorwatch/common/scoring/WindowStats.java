package com.mirrorwatch.common.scoring;

/**
 * Healthy and total check counts over one time window.
 */
public record WindowStats(long healthy, long total) {

    public static final WindowStats EMPTY = new WindowStats(0, 0);

    public WindowStats {
        if (healthy < 0 || total < 0 || healthy > total) {
            throw new IllegalArgumentException("Invalid window counts healthy=" + healthy + " total=" + total);
        }
    }

    /** Healthy percentage in [0, 100], or {@code null} when the window holds no checks. */
    public Double percentage() {
        return total == 0 ? null : healthy * 100.0 / total;
    }

    /** Healthy fraction in [0, 1]; an empty window counts as 0. */
    public double fraction() {
        return total == 0 ? 0.0 : (double) healthy / total;
    }
}
