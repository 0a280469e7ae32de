package com.marketfeed.marketdata.snapshot;

import java.time.Duration;

/**
 * Whether an asset's history is deep enough for windowed analytics.
 *
 * @param oldestAge age of the oldest snapshot, {@link Duration#ZERO} when there is none
 */
public record DataSufficiency(
    String asset,
    boolean sufficient,
    int count,
    Duration oldestAge
) {}
