package com.marketfeed.common.percentile;

import com.marketfeed.common.model.HorizonProbabilities;
import com.marketfeed.common.model.PercentileAnalysis;
import com.marketfeed.common.model.PercentileAnalysis.DataPoint;
import com.marketfeed.common.model.PercentileTrend;
import com.marketfeed.common.model.ProbabilityDistribution;
import com.marketfeed.common.model.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PercentileTrendCalculatorTest {

    private static final long NOW  = 1_700_000_000_000L;
    private static final long HOUR = 3_600_000L;
    private static final double PRICE = 65_000.0;
    private static final double EPS = 1e-9;

    private static Snapshot snapshot(double hoursAgo, double probabilityBelow) {
        long timestamp = NOW - Math.round(hoursAgo * HOUR);
        return new Snapshot(timestamp, ProbabilityDistribution.of24h(
            HorizonProbabilities.ofBelow(Map.of("65000", probabilityBelow)), PRICE));
    }

    // ── analyze() ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("analyze()")
    class AnalyzeTests {

        @Test
        @DisplayName("23h/10h/4h at 0.2/0.5/0.8 → RISING, current 80, range 60")
        void risingScenario() {
            List<Snapshot> snapshots = List.of(snapshot(23, 0.2), snapshot(10, 0.5), snapshot(4, 0.8));

            PercentileAnalysis result = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW);

            assertEquals(3, result.dataPoints().size());
            assertEquals(20.0, result.min(), EPS);
            assertEquals(80.0, result.max(), EPS);
            assertEquals(50.0, result.average(), EPS);
            assertEquals(50.0, result.median(), EPS);
            assertEquals(80.0, result.currentPercentile(), EPS);
            assertEquals(60.0, result.range(), EPS);
            assertEquals(PercentileTrend.RISING, result.trend());
            assertTrue(result.trendStrength() > 0.9 && result.trendStrength() <= 1.0);
        }

        @Test
        @DisplayName("data points sorted oldest first with hoursAgo")
        void pointsSortedAscending() {
            List<Snapshot> snapshots = List.of(snapshot(4, 0.8), snapshot(23, 0.2), snapshot(10, 0.5));

            List<DataPoint> points = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW).dataPoints();

            assertEquals(23.0, points.get(0).hoursAgo(), EPS);
            assertEquals(10.0, points.get(1).hoursAgo(), EPS);
            assertEquals(4.0, points.get(2).hoursAgo(), EPS);
            assertTrue(points.get(0).timestamp() < points.get(2).timestamp());
        }

        @Test
        @DisplayName("empty window → neutral default")
        void emptyWindow_returnsNeutral() {
            PercentileAnalysis result = PercentileTrendCalculator.analyze("ETH", 3_000.0, List.of(), NOW);

            assertEquals(50.0, result.min(), EPS);
            assertEquals(50.0, result.max(), EPS);
            assertEquals(50.0, result.average(), EPS);
            assertEquals(50.0, result.median(), EPS);
            assertEquals(50.0, result.currentPercentile(), EPS);
            assertEquals(0.0, result.range(), EPS);
            assertEquals(PercentileTrend.STABLE, result.trend());
            assertEquals(0.0, result.trendStrength(), EPS);
            assertTrue(result.dataPoints().isEmpty());
        }

        @Test
        @DisplayName("snapshots only outside 3h..24h → neutral default")
        void outsideWindow_returnsNeutral() {
            List<Snapshot> snapshots = List.of(snapshot(1, 0.9), snapshot(2.5, 0.9), snapshot(30, 0.1));

            PercentileAnalysis result = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW);

            assertTrue(result.dataPoints().isEmpty());
            assertEquals(50.0, result.currentPercentile(), EPS);
        }

        @Test
        @DisplayName("falling percentiles → FALLING")
        void fallingScenario() {
            List<Snapshot> snapshots = List.of(snapshot(20, 0.8), snapshot(12, 0.5), snapshot(5, 0.2));

            PercentileAnalysis result = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW);

            assertEquals(PercentileTrend.FALLING, result.trend());
            assertEquals(20.0, result.currentPercentile(), EPS);
        }

        @Test
        @DisplayName("flat percentiles → STABLE with zero strength")
        void flatScenario() {
            List<Snapshot> snapshots = List.of(snapshot(20, 0.4), snapshot(12, 0.4), snapshot(5, 0.4));

            PercentileAnalysis result = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW);

            assertEquals(PercentileTrend.STABLE, result.trend());
            assertEquals(0.0, result.trendStrength(), EPS);
            assertEquals(0.0, result.range(), EPS);
        }

        @Test
        @DisplayName("single point → STABLE, strength 0, current = that point")
        void singlePoint() {
            PercentileAnalysis result = PercentileTrendCalculator.analyze(
                "BTC", PRICE, List.of(snapshot(6, 0.35)), NOW);

            assertEquals(1, result.dataPoints().size());
            assertEquals(PercentileTrend.STABLE, result.trend());
            assertEquals(0.0, result.trendStrength(), EPS);
            assertEquals(35.0, result.currentPercentile(), EPS);
        }

        @Test
        @DisplayName("snapshot without a usable curve is skipped")
        void unusableSnapshot_skipped() {
            List<Snapshot> snapshots = new ArrayList<>();
            snapshots.add(snapshot(10, 0.5));
            snapshots.add(new Snapshot(NOW - 8 * HOUR, new ProbabilityDistribution(Map.of(), PRICE)));

            PercentileAnalysis result = PercentileTrendCalculator.analyze("BTC", PRICE, snapshots, NOW);

            assertEquals(1, result.dataPoints().size());
            assertEquals(50.0, result.currentPercentile(), EPS);
        }
    }

    // ── window ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("inAnalysisWindow()")
    class WindowTests {

        @Test
        @DisplayName("bounds are exclusive at 3h and 24h")
        void exclusiveBounds() {
            assertFalse(PercentileTrendCalculator.inAnalysisWindow(NOW - 3 * HOUR, NOW));
            assertFalse(PercentileTrendCalculator.inAnalysisWindow(NOW - 24 * HOUR, NOW));
            assertTrue(PercentileTrendCalculator.inAnalysisWindow(NOW - 3 * HOUR - 1, NOW));
            assertTrue(PercentileTrendCalculator.inAnalysisWindow(NOW - 24 * HOUR + 1, NOW));
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("median() / classify() / regress()")
    class HelperTests {

        @Test
        @DisplayName("median of odd and even samples")
        void median() {
            assertEquals(30.0, PercentileTrendCalculator.median(List.of(50.0, 10.0, 30.0)), EPS);
            assertEquals(25.0, PercentileTrendCalculator.median(List.of(40.0, 10.0, 30.0, 20.0)), EPS);
        }

        @Test
        @DisplayName("slope threshold 0.5 separates STABLE from a trend")
        void classify() {
            assertEquals(PercentileTrend.STABLE, PercentileTrendCalculator.classify(0.49));
            assertEquals(PercentileTrend.STABLE, PercentileTrendCalculator.classify(-0.49));
            assertEquals(PercentileTrend.RISING, PercentileTrendCalculator.classify(0.5));
            assertEquals(PercentileTrend.FALLING, PercentileTrendCalculator.classify(-0.5));
        }

        @Test
        @DisplayName("perfect line → slope per hour, R² = 1")
        void perfectLine() {
            List<DataPoint> points = List.of(
                new DataPoint(0, 10.0, 20.0),
                new DataPoint(HOUR, 12.0, 19.0),
                new DataPoint(2 * HOUR, 14.0, 18.0));

            PercentileTrendCalculator.Regression regression = PercentileTrendCalculator.regress(points);

            assertEquals(2.0, regression.slope(), EPS);
            assertEquals(1.0, regression.rSquared(), EPS);
        }
    }
}
