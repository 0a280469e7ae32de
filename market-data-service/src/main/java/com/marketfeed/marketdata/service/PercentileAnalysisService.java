package com.marketfeed.marketdata.service;

import com.marketfeed.common.model.PercentileAnalysis;
import com.marketfeed.common.model.Snapshot;
import com.marketfeed.common.percentile.DistributionPercentile;
import com.marketfeed.common.percentile.PercentileTrendCalculator;
import com.marketfeed.marketdata.snapshot.DataSufficiency;
import com.marketfeed.marketdata.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Where a price sits inside recent LP-bounds forecasts. Reads only from the
 * {@link SnapshotStore}; results are computed per call and never cached.
 */
@Service
public class PercentileAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PercentileAnalysisService.class);

    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public PercentileAnalysisService(SnapshotStore snapshotStore, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.clock         = clock;
    }

    public PercentileAnalysis analyze(String asset, double currentPrice) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset is required");
        }
        String symbol = asset.trim().toUpperCase(Locale.ROOT);
        long now = clock.millis();
        List<Snapshot> window = snapshotStore.query(symbol,
            timestamp -> PercentileTrendCalculator.inAnalysisWindow(timestamp, now));
        PercentileAnalysis analysis = PercentileTrendCalculator.analyze(symbol, currentPrice, window, now);
        log.info("PERCENTILE_ANALYSIS asset={} price={} points={} current={} trend={} strength={}",
                 symbol, currentPrice, analysis.dataPoints().size(), analysis.currentPercentile(),
                 analysis.trend(), analysis.trendStrength());
        return analysis;
    }

    /**
     * Percentile of {@code price} in the snapshot taken closest to {@code ago} before now.
     * Empty when the asset has no snapshots or the nearest one carries no usable curve.
     */
    public OptionalDouble percentileAt(String asset, double price, Duration ago) {
        long target = clock.millis() - ago.toMillis();
        return snapshotStore.nearest(asset, target)
            .map(snapshot -> DistributionPercentile.percentileAt(snapshot.bounds(), price))
            .orElse(OptionalDouble.empty());
    }

    public DataSufficiency sufficiency(String asset, int minCount, Duration minAge) {
        return snapshotStore.sufficiency(asset, minCount, minAge);
    }
}
