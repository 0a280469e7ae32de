package com.marketfeed.common.percentile;

import com.marketfeed.common.model.ConsolidatedPrediction;
import com.marketfeed.common.model.ConsolidatedPrediction.MinerPrice;
import com.marketfeed.common.model.PredictionPercentiles;
import com.marketfeed.common.model.PredictionPercentiles.Band;
import com.marketfeed.common.model.PredictionTrend;
import com.marketfeed.common.model.PredictionTrend.Direction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictionPercentileCalculatorTest {

    private static final double EPS = 1e-9;
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private static String time(int index) {
        return START.plusSeconds(300L * index).toString();
    }

    /** One miner price per 5-minute point, price = index + 1. */
    private static List<ConsolidatedPrediction> path(int points) {
        List<ConsolidatedPrediction> consolidated = new ArrayList<>();
        for (int i = 0; i < points; i++) {
            consolidated.add(new ConsolidatedPrediction(time(i), List.of(new MinerPrice(7, 1, i + 1.0))));
        }
        return consolidated;
    }

    private static Band band(double p50) {
        return new Band("t", "s", "e", p50, p50, p50, p50, p50, p50, p50, p50, p50);
    }

    private static List<Band> bands(double start, double stepPct, int hours) {
        List<Band> bands = new ArrayList<>();
        double value = start;
        for (int i = 0; i < hours; i++) {
            bands.add(band(value));
            value = value * (1 + stepPct / 100.0);
        }
        return bands;
    }

    // ── calculate() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("calculate()")
    class CalculateTests {

        @Test
        @DisplayName("24 points → two hourly bands with median-point timestamp")
        void groupsTwelvePointsPerHour() {
            PredictionPercentiles result = PredictionPercentileCalculator.calculate(path(24), 6.5);

            assertEquals(2, result.bands().size());
            Band first = result.bands().get(0);
            assertEquals(time(0), first.startTime());
            assertEquals(time(11), first.endTime());
            assertEquals(time(6), first.timestamp());
            assertEquals(time(12), result.bands().get(1).startTime());
        }

        @Test
        @DisplayName("band levels interpolate over sorted prices")
        void bandLevels() {
            Band first = PredictionPercentileCalculator.calculate(path(12), 1.0).bands().get(0);

            // prices 1..12, index = pct/100 × 11
            assertEquals(6.5, first.p50(), EPS);
            assertEquals(1.055, first.p0_5(), EPS);
            assertEquals(11.945, first.p99_5(), EPS);
            assertTrue(first.p5() < first.p20() && first.p80() < first.p95());
        }

        @Test
        @DisplayName("current price ranked against the first hour only")
        void currentPriceRank() {
            assertEquals(50, PredictionPercentileCalculator.calculate(path(24), 6.5).currentPricePercentile());
            assertEquals(100, PredictionPercentileCalculator.calculate(path(24), 20.0).currentPricePercentile());
            assertEquals(0, PredictionPercentileCalculator.calculate(path(24), 1.0).currentPricePercentile());
        }

        @Test
        @DisplayName("no predictions → no bands, rank 50")
        void emptyInput() {
            PredictionPercentiles result = PredictionPercentileCalculator.calculate(List.of(), 100.0);

            assertTrue(result.bands().isEmpty());
            assertEquals(50, result.currentPricePercentile());
        }

        @Test
        @DisplayName("trailing partial hour becomes its own band")
        void partialHour() {
            assertEquals(3, PredictionPercentileCalculator.calculate(path(30), 1.0).bands().size());
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("percentileRank(): share strictly below, 50 when empty")
    void percentileRank() {
        assertEquals(50, PredictionPercentileCalculator.percentileRank(new double[0], 10));
        assertEquals(50, PredictionPercentileCalculator.percentileRank(new double[] {1, 2, 3, 4}, 3));
        assertEquals(33, PredictionPercentileCalculator.percentileRank(new double[] {1, 2, 3}, 2));
    }

    @Test
    @DisplayName("valueAt(): exact ranks and interpolation")
    void valueAt() {
        double[] sorted = {10, 20, 30, 40, 50};
        assertEquals(30.0, PredictionPercentileCalculator.valueAt(sorted, 50), EPS);
        assertEquals(10.2, PredictionPercentileCalculator.valueAt(sorted, 0.5), EPS);
        assertEquals(49.8, PredictionPercentileCalculator.valueAt(sorted, 99.5), EPS);
        assertEquals(0.0, PredictionPercentileCalculator.valueAt(new double[0], 50), EPS);
    }

    // ── detectTrend() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detectTrend()")
    class TrendTests {

        @Test
        @DisplayName("fewer than 6 hours → NEUTRAL, strength 0")
        void tooFewHours() {
            assertEquals(PredictionTrend.neutral(), PredictionPercentileCalculator.detectTrend(bands(100, 1, 5)));
        }

        @Test
        @DisplayName("+1 %/h over 6h → UPWARD, score 5.0")
        void upward() {
            PredictionTrend trend = PredictionPercentileCalculator.detectTrend(bands(100, 1, 6));

            assertEquals(Direction.UPWARD, trend.direction());
            assertEquals(5.0, trend.strength(), EPS);
        }

        @Test
        @DisplayName("−1 %/h over 24h → DOWNWARD")
        void downward() {
            PredictionTrend trend = PredictionPercentileCalculator.detectTrend(bands(100, -1, 24));

            assertEquals(Direction.DOWNWARD, trend.direction());
            assertTrue(trend.strength() < -1.5);
        }

        @Test
        @DisplayName("moves below every threshold → NEUTRAL")
        void flat() {
            PredictionTrend trend = PredictionPercentileCalculator.detectTrend(bands(100, 0.01, 24));

            assertEquals(Direction.NEUTRAL, trend.direction());
            assertEquals(0.0, trend.strength(), EPS);
        }
    }
}
