package com.marketfeed.common.model;

import java.util.List;

/**
 * All miners' predicted prices for one future time point.
 *
 * @param time        ISO-8601 time of the predicted point
 * @param predictions one entry per contributing miner
 */
public record ConsolidatedPrediction(String time, List<MinerPrice> predictions) {

    public ConsolidatedPrediction {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }

    /**
     * @param rank 1-based rank of the miner in the latest validation scores
     */
    public record MinerPrice(long minerUid, int rank, double price) {}
}
