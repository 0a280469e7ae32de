package com.marketfeed.common.model;

/**
 * Direction of the regression line fitted through a percentile history.
 */
public enum PercentileTrend {
    RISING,
    FALLING,
    STABLE
}
