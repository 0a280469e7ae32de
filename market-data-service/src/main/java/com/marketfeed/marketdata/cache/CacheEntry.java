package com.marketfeed.marketdata.cache;

import java.time.Instant;

/**
 * Immutable cache entry: a fetched value and the instant its fetch completed. Replaced
 * wholesale on refresh.
 */
public record CacheEntry<T>(
    ResourceKey key,
    T value,
    Instant fetchedAt
) {}
