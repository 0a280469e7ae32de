package com.marketfeed.common.percentile;

import com.marketfeed.common.model.HorizonProbabilities;
import com.marketfeed.common.model.ProbabilityDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Reads a price's percentile off a 24h LP-bounds forecast.
 *
 * <p>The {@code probability_below} curve is the forecast CDF, so the percentile of a price is
 * {@code 100 × P(below price)}. Between listed price levels the curve is interpolated
 * linearly; outside them it is clamped to the nearest level. When the forecast only carries
 * {@code probability_above}, the complement {@code 100 × (1 − P(above price))} is used.
 *
 * <p>Pure static utility.
 */
public final class DistributionPercentile {

    private static final Logger log = LoggerFactory.getLogger(DistributionPercentile.class);

    private DistributionPercentile() {}

    /**
     * @return percentile of {@code price} in [0, 100], or empty when the forecast has no
     *         usable 24h curve
     */
    public static OptionalDouble percentileAt(ProbabilityDistribution distribution, double price) {
        if (distribution == null) {
            return OptionalDouble.empty();
        }
        HorizonProbabilities horizon = distribution.horizon(ProbabilityDistribution.HORIZON_24H);
        if (horizon == null) {
            return OptionalDouble.empty();
        }

        NavigableMap<Double, Double> below = toCurve(horizon.probabilityBelow());
        if (!below.isEmpty()) {
            return OptionalDouble.of(clamp(100.0 * interpolate(below, price)));
        }
        NavigableMap<Double, Double> above = toCurve(horizon.probabilityAbove());
        if (!above.isEmpty()) {
            return OptionalDouble.of(clamp(100.0 * (1.0 - interpolate(above, price))));
        }
        return OptionalDouble.empty();
    }

    static NavigableMap<Double, Double> toCurve(Map<String, Double> levels) {
        NavigableMap<Double, Double> curve = new TreeMap<>();
        for (Map.Entry<String, Double> level : levels.entrySet()) {
            if (level.getValue() == null || level.getValue().isNaN()) {
                continue;
            }
            try {
                curve.put(Double.parseDouble(level.getKey().trim()), level.getValue());
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric price level '{}'", level.getKey());
            }
        }
        return curve;
    }

    static double interpolate(NavigableMap<Double, Double> curve, double price) {
        Map.Entry<Double, Double> floor = curve.floorEntry(price);
        Map.Entry<Double, Double> ceiling = curve.ceilingEntry(price);
        if (floor == null) {
            return ceiling.getValue();
        }
        if (ceiling == null || floor.getKey().equals(ceiling.getKey())) {
            return floor.getValue();
        }
        double weight = (price - floor.getKey()) / (ceiling.getKey() - floor.getKey());
        return floor.getValue() + weight * (ceiling.getValue() - floor.getValue());
    }

    private static double clamp(double percentile) {
        return Math.max(0.0, Math.min(100.0, percentile));
    }
}
