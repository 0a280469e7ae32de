package com.marketfeed.common.model;

import java.util.List;

/**
 * Where a price sits inside the recent history of 24h forecasts for an asset.
 *
 * <p>Derived on demand from the snapshot history; never cached or persisted. All percentile
 * values are on a 0–100 scale.
 *
 * @param currentPercentile percentile under the most recent snapshot of the analysis window
 * @param trendStrength     |R²| of the percentile-vs-time regression, in [0, 1]
 */
public record PercentileAnalysis(
    String asset,
    double currentPrice,
    List<DataPoint> dataPoints,
    double min,
    double max,
    double average,
    double median,
    PercentileTrend trend,
    double trendStrength,
    double currentPercentile,
    double range
) {
    public static final double NEUTRAL_PERCENTILE = 50.0;

    public PercentileAnalysis {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
    }

    /** Result returned when no snapshot falls inside the analysis window. */
    public static PercentileAnalysis neutral(String asset, double currentPrice) {
        return new PercentileAnalysis(asset, currentPrice, List.of(),
            NEUTRAL_PERCENTILE, NEUTRAL_PERCENTILE, NEUTRAL_PERCENTILE, NEUTRAL_PERCENTILE,
            PercentileTrend.STABLE, 0.0, NEUTRAL_PERCENTILE, 0.0);
    }

    public record DataPoint(long timestamp, double percentile, double hoursAgo) {}
}
