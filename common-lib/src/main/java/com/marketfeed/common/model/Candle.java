package com.marketfeed.common.model;

/**
 * OHLC bar. {@code timestamp} is the bar open time in epoch seconds, as GMX serves it.
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close
) {}
