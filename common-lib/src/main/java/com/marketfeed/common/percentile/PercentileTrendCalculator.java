package com.marketfeed.common.percentile;

import com.marketfeed.common.model.PercentileAnalysis;
import com.marketfeed.common.model.PercentileAnalysis.DataPoint;
import com.marketfeed.common.model.PercentileTrend;
import com.marketfeed.common.model.Snapshot;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Percentile history and trend of a price across recent 24h forecasts.
 *
 * <h3>Window</h3>
 * Only snapshots strictly between {@link #WINDOW_MIN_AGE} (3h) and {@link #WINDOW_MAX_AGE}
 * (24h) old are used. An empty window yields {@link PercentileAnalysis#neutral}.
 *
 * <h3>Trend</h3>
 * <pre>
 *   x = hours since the earliest point, y = percentile
 *   |slope| &lt; 0.5 pct-pts/h → STABLE, slope &gt; 0 → RISING, slope &lt; 0 → FALLING
 *   trendStrength = |R²|
 * </pre>
 *
 * <p>Pure function of (snapshots, price, now).
 */
public final class PercentileTrendCalculator {

    public static final Duration WINDOW_MIN_AGE = Duration.ofHours(3);
    public static final Duration WINDOW_MAX_AGE = Duration.ofHours(24);
    public static final double STABLE_SLOPE_THRESHOLD = 0.5;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private PercentileTrendCalculator() {}

    /** @return {@code true} when a snapshot taken at {@code timestamp} belongs to the analysis window */
    public static boolean inAnalysisWindow(long timestamp, long nowMillis) {
        long age = nowMillis - timestamp;
        return age > WINDOW_MIN_AGE.toMillis() && age < WINDOW_MAX_AGE.toMillis();
    }

    public static PercentileAnalysis analyze(String asset, double currentPrice,
                                             List<Snapshot> snapshots, long nowMillis) {
        List<DataPoint> points = new ArrayList<>();
        for (Snapshot snapshot : snapshots) {
            if (!inAnalysisWindow(snapshot.timestamp(), nowMillis)) {
                continue;
            }
            OptionalDouble percentile = DistributionPercentile.percentileAt(snapshot.bounds(), currentPrice);
            if (percentile.isPresent()) {
                double hoursAgo = (nowMillis - snapshot.timestamp()) / MILLIS_PER_HOUR;
                points.add(new DataPoint(snapshot.timestamp(), percentile.getAsDouble(), hoursAgo));
            }
        }
        if (points.isEmpty()) {
            return PercentileAnalysis.neutral(asset, currentPrice);
        }
        points.sort(Comparator.comparingLong(DataPoint::timestamp));

        List<Double> values = points.stream().map(DataPoint::percentile).toList();
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        double average = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();

        Regression regression = regress(points);

        return new PercentileAnalysis(
            asset,
            currentPrice,
            points,
            min,
            max,
            average,
            median(values),
            classify(regression.slope()),
            regression.rSquared(),
            points.get(points.size() - 1).percentile(),
            max - min
        );
    }

    static PercentileTrend classify(double slope) {
        if (Math.abs(slope) < STABLE_SLOPE_THRESHOLD) return PercentileTrend.STABLE;
        return slope > 0 ? PercentileTrend.RISING : PercentileTrend.FALLING;
    }

    static double median(List<Double> values) {
        List<Double> sorted = values.stream().sorted().toList();
        int n = sorted.size();
        if (n == 0) return PercentileAnalysis.NEUTRAL_PERCENTILE;
        int mid = n / 2;
        return n % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Ordinary least squares of percentile on hours elapsed since the first point.
     * Points must be sorted oldest first.
     */
    static Regression regress(List<DataPoint> points) {
        int n = points.size();
        if (n < 2) {
            return new Regression(0.0, 0.0);
        }
        long origin = points.get(0).timestamp();
        double sumX = 0, sumY = 0;
        for (DataPoint p : points) {
            sumX += (p.timestamp() - origin) / MILLIS_PER_HOUR;
            sumY += p.percentile();
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double sxx = 0, syy = 0, sxy = 0;
        for (DataPoint p : points) {
            double dx = (p.timestamp() - origin) / MILLIS_PER_HOUR - meanX;
            double dy = p.percentile() - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        if (sxx == 0.0) {
            return new Regression(0.0, 0.0);
        }
        double slope = sxy / sxx;
        double rSquared = syy == 0.0 ? 0.0 : Math.min(1.0, Math.abs((sxy * sxy) / (sxx * syy)));
        return new Regression(slope, rSquared);
    }

    record Regression(double slope, double rSquared) {}
}
