package com.marketfeed.common.percentile;

import com.marketfeed.common.model.ConsolidatedPrediction;
import com.marketfeed.common.model.ConsolidatedPrediction.MinerPrice;
import com.marketfeed.common.model.PredictionPercentiles;
import com.marketfeed.common.model.PredictionPercentiles.Band;
import com.marketfeed.common.model.PredictionTrend;
import com.marketfeed.common.model.PredictionTrend.Direction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Percentile bands over consolidated miner price paths.
 *
 * <p>Predictions arrive at 5-minute increments, so twelve consecutive time points form one
 * hour. For every hour all miners' prices are pooled and read at fixed percentiles
 * (0.5, 5, 20, 35, 50, 65, 80, 95, 99.5) with linear interpolation between ranks.
 *
 * <p>Pure static utility.
 */
public final class PredictionPercentileCalculator {

    public static final int POINTS_PER_HOUR = 12;

    private static final int MIN_TREND_HOURS = 6;
    private static final double TREND_THRESHOLD = 1.5;

    private PredictionPercentileCalculator() {}

    public static PredictionPercentiles calculate(List<ConsolidatedPrediction> consolidated,
                                                  double currentPrice) {
        List<List<ConsolidatedPrediction>> hours = groupByHour(consolidated);

        List<Band> bands = new ArrayList<>();
        for (List<ConsolidatedPrediction> hour : hours) {
            double[] prices = pooledPrices(hour);
            Arrays.sort(prices);
            bands.add(new Band(
                hour.get(hour.size() / 2).time(),
                hour.get(0).time(),
                hour.get(hour.size() - 1).time(),
                valueAt(prices, 0.5),
                valueAt(prices, 5),
                valueAt(prices, 20),
                valueAt(prices, 35),
                valueAt(prices, 50),
                valueAt(prices, 65),
                valueAt(prices, 80),
                valueAt(prices, 95),
                valueAt(prices, 99.5)
            ));
        }

        int currentRank = hours.isEmpty() ? percentileRank(new double[0], currentPrice)
                                          : percentileRank(pooledPrices(hours.get(0)), currentPrice);
        return new PredictionPercentiles(bands, currentRank);
    }

    /**
     * Rank of {@code price} among {@code prices}: share of prices strictly below it, 0–100.
     * An empty sample ranks at 50.
     */
    public static int percentileRank(double[] prices, double price) {
        if (prices.length == 0) return 50;
        long below = Arrays.stream(prices).filter(p -> p < price).count();
        return (int) Math.round(100.0 * below / prices.length);
    }

    /**
     * Weighted multi-horizon score over hour-to-hour changes of the predicted median:
     * <pre>
     *   first  6h: ±1 per move beyond 0.10 %, weight 0.6
     *   first 12h: ±1 per move beyond 0.05 %, weight 0.3
     *   first 24h: ±1 per move beyond 0.02 %, weight 0.1
     *   score &gt; 1.5 → UPWARD, score &lt; −1.5 → DOWNWARD
     * </pre>
     * Fewer than six hourly bands is always NEUTRAL.
     */
    public static PredictionTrend detectTrend(List<Band> bands) {
        if (bands.size() < MIN_TREND_HOURS) {
            return PredictionTrend.neutral();
        }
        double shortTerm  = horizonScore(bands, Math.min(6, bands.size()), 0.1);
        double mediumTerm = horizonScore(bands, Math.min(12, bands.size()), 0.05);
        double longTerm   = horizonScore(bands, Math.min(24, bands.size()), 0.02);

        double score = shortTerm * 0.6 + mediumTerm * 0.3 + longTerm * 0.1;
        Direction direction = score > TREND_THRESHOLD ? Direction.UPWARD
            : score < -TREND_THRESHOLD ? Direction.DOWNWARD
            : Direction.NEUTRAL;
        return new PredictionTrend(direction, score);
    }

    // ── internals ─────────────────────────────────────────────────────────────

    static List<List<ConsolidatedPrediction>> groupByHour(List<ConsolidatedPrediction> consolidated) {
        List<List<ConsolidatedPrediction>> hours = new ArrayList<>();
        for (int i = 0; i < consolidated.size(); i += POINTS_PER_HOUR) {
            hours.add(consolidated.subList(i, Math.min(i + POINTS_PER_HOUR, consolidated.size())));
        }
        return hours;
    }

    private static double[] pooledPrices(List<ConsolidatedPrediction> hour) {
        return hour.stream()
            .flatMap(point -> point.predictions().stream())
            .mapToDouble(MinerPrice::price)
            .toArray();
    }

    /** Linear-interpolated value at {@code percentile} of an ascending array; 0 when empty. */
    static double valueAt(double[] sorted, double percentile) {
        if (sorted.length == 0) return 0.0;
        double index = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) return sorted[lower];
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    private static double horizonScore(List<Band> bands, int hours, double thresholdPct) {
        double score = 0;
        for (int i = 1; i < hours; i++) {
            double previous = bands.get(i - 1).p50();
            double current  = bands.get(i).p50();
            double changePct = previous > 0 ? (current - previous) / previous * 100.0 : 0.0;
            if (changePct > thresholdPct) score += 1;
            else if (changePct < -thresholdPct) score -= 1;
        }
        return score;
    }
}
