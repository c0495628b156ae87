package com.mirrorwatch.common.scoring;

import com.mirrorwatch.common.model.VersionFreshness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstanceScoreCalculatorTest {

    private static ScoreInputs inputs(WindowStats w3h, WindowStats w30d, WindowStats w120d,
                                      VersionFreshness freshness, boolean badHost) {
        return new ScoreInputs(true, w3h, w30d, w120d, List.of(), freshness, badHost);
    }

    @Nested
    @DisplayName("points")
    class PointsTests {

        @Test
        @DisplayName("perfect record on the latest version → 80")
        void perfectLatest() {
            WindowStats all = new WindowStats(10, 10);
            InstanceScore score = InstanceScoreCalculator.compute(
                inputs(all, all, all, VersionFreshness.LATEST, false));

            assertEquals(80, score.points());
            assertTrue(score.ranked());
        }

        @Test
        @DisplayName("outdated upstream version earns half the version term")
        void outdatedUpstream() {
            WindowStats all = new WindowStats(10, 10);
            InstanceScore score = InstanceScoreCalculator.compute(
                inputs(all, all, all, VersionFreshness.OUTDATED_UPSTREAM, false));

            assertEquals(75, score.points());
        }

        @Test
        @DisplayName("down for the last 3h → 0 whatever the history")
        void gatedByCurrentState() {
            WindowStats all = new WindowStats(10, 10);
            InstanceScore score = InstanceScoreCalculator.compute(
                inputs(new WindowStats(0, 4), all, all, VersionFreshness.LATEST, false));

            assertEquals(0, score.points());
        }

        @Test
        @DisplayName("80% healthy everywhere, no version → round(100 × 0.8 × 0.56)")
        void partiallyHealthy() {
            WindowStats mostly = new WindowStats(8, 10);
            InstanceScore score = InstanceScoreCalculator.compute(
                inputs(mostly, mostly, mostly, VersionFreshness.MISSING, false));

            assertEquals(45, score.points());
        }

        @Test
        @DisplayName("improving a long window never lowers the points")
        void monotoneInWindows() {
            WindowStats w3h = new WindowStats(3, 4);
            int worse = InstanceScoreCalculator.compute(
                inputs(w3h, new WindowStats(10, 20), new WindowStats(50, 100), VersionFreshness.NON_UPSTREAM, false)).points();
            int better = InstanceScoreCalculator.compute(
                inputs(w3h, new WindowStats(15, 20), new WindowStats(50, 100), VersionFreshness.NON_UPSTREAM, false)).points();

            assertTrue(better >= worse);
        }

        @Test
        @DisplayName("bad host → scored but not ranked")
        void badHostUnranked() {
            WindowStats all = new WindowStats(10, 10);
            InstanceScore score = InstanceScoreCalculator.compute(
                inputs(all, all, all, VersionFreshness.LATEST, true));

            assertEquals(80, score.points());
            assertFalse(score.ranked());
        }
    }

    @Nested
    @DisplayName("percentages and response times")
    class DerivedTests {

        @Test
        @DisplayName("empty windows → null percentages and zero points")
        void emptyWindows() {
            InstanceScore score = InstanceScoreCalculator.compute(
                new ScoreInputs(false, null, null, null, null, null, false));

            assertNull(score.pct3h());
            assertNull(score.pct30d());
            assertNull(score.pct120d());
            assertNull(score.avgResponseMs());
            assertEquals(0, score.points());
        }

        @Test
        @DisplayName("response time statistics skip nulls")
        void responseTimes() {
            ScoreInputs in = new ScoreInputs(true, new WindowStats(3, 4), null, null,
                Arrays.asList(100, null, 200, 301), VersionFreshness.LATEST, false);
            InstanceScore score = InstanceScoreCalculator.compute(in);

            assertEquals(200, score.avgResponseMs());
            assertEquals(100, score.minResponseMs());
            assertEquals(301, score.maxResponseMs());
            assertEquals(75.0, score.pct3h(), 1e-9);
        }

        @Test
        @DisplayName("window counts must be consistent")
        void rejectsInvalidWindow() {
            assertThrows(IllegalArgumentException.class, () -> new WindowStats(5, 4));
        }
    }
}
