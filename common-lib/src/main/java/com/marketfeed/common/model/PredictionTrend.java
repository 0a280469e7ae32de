package com.marketfeed.common.model;

/**
 * Direction of the predicted median path, scored across short, medium and long horizons.
 *
 * @param strength weighted score; positive for upward moves, negative for downward
 */
public record PredictionTrend(Direction direction, double strength) {

    public enum Direction {
        UPWARD,
        DOWNWARD,
        NEUTRAL
    }

    public static PredictionTrend neutral() {
        return new PredictionTrend(Direction.NEUTRAL, 0.0);
    }
}
