package com.marketfeed.common.percentile;

import com.marketfeed.common.model.HorizonProbabilities;
import com.marketfeed.common.model.ProbabilityDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Percentile reads off the 24h probability curves.
 */
class DistributionPercentileTest {

    private static final double EPS = 1e-9;

    private static ProbabilityDistribution below(Map<String, Double> levels) {
        return ProbabilityDistribution.of24h(HorizonProbabilities.ofBelow(levels), 65_000.0);
    }

    @Test
    @DisplayName("interpolates linearly between price levels")
    void interpolatesBetweenLevels() {
        ProbabilityDistribution d = below(Map.of("60000", 0.1, "70000", 0.9));

        assertEquals(50.0, DistributionPercentile.percentileAt(d, 65_000).getAsDouble(), EPS);
        assertEquals(30.0, DistributionPercentile.percentileAt(d, 62_500).getAsDouble(), EPS);
    }

    @Test
    @DisplayName("prices outside the listed levels clamp to the nearest level")
    void clampsOutsideLevels() {
        ProbabilityDistribution d = below(Map.of("60000", 0.1, "70000", 0.9));

        assertEquals(10.0, DistributionPercentile.percentileAt(d, 50_000).getAsDouble(), EPS);
        assertEquals(90.0, DistributionPercentile.percentileAt(d, 80_000).getAsDouble(), EPS);
    }

    @Test
    @DisplayName("only probability_above → complement")
    void fallsBackToAbove() {
        ProbabilityDistribution d = ProbabilityDistribution.of24h(
            new HorizonProbabilities(Map.of("65000", 0.3), Map.of()), 65_000.0);

        assertEquals(70.0, DistributionPercentile.percentileAt(d, 65_000).getAsDouble(), EPS);
    }

    @Test
    @DisplayName("result clamped to [0, 100]")
    void resultClamped() {
        ProbabilityDistribution d = below(Map.of("65000", 1.2));

        assertEquals(100.0, DistributionPercentile.percentileAt(d, 65_000).getAsDouble(), EPS);
    }

    @Test
    @DisplayName("non-numeric price levels are ignored")
    void skipsNonNumericLevels() {
        Map<String, Double> levels = new LinkedHashMap<>();
        levels.put("n/a", 0.99);
        levels.put("65000", 0.4);

        assertEquals(40.0, DistributionPercentile.percentileAt(below(levels), 65_000).getAsDouble(), EPS);
    }

    @Test
    @DisplayName("no 24h horizon or null distribution → empty")
    void noUsableCurve() {
        ProbabilityDistribution other = new ProbabilityDistribution(
            Map.of("1h", HorizonProbabilities.ofBelow(Map.of("65000", 0.5))), 65_000.0);

        assertEquals(OptionalDouble.empty(), DistributionPercentile.percentileAt(other, 65_000));
        assertEquals(OptionalDouble.empty(), DistributionPercentile.percentileAt(null, 65_000));
        assertEquals(OptionalDouble.empty(),
            DistributionPercentile.percentileAt(below(Map.of()), 65_000));
    }
}
