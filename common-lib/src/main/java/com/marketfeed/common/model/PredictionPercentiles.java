package com.marketfeed.common.model;

import java.util.List;

/**
 * Hourly percentile bands over consolidated miner predictions.
 *
 * @param currentPricePercentile rank (0–100) of the current price among the first hour's
 *                               predicted prices
 */
public record PredictionPercentiles(
    List<Band> bands,
    int currentPricePercentile
) {
    public PredictionPercentiles {
        bands = bands == null ? List.of() : List.copyOf(bands);
    }

    /** Price levels at fixed percentiles for one hour of predictions. */
    public record Band(
        String timestamp,
        String startTime,
        String endTime,
        double p0_5,
        double p5,
        double p20,
        double p35,
        double p50,
        double p65,
        double p80,
        double p95,
        double p99_5
    ) {}
}
