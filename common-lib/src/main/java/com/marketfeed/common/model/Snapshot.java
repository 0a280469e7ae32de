package com.marketfeed.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One timestamped capture of an asset's LP-bounds forecast.
 *
 * @param timestamp capture time, epoch milliseconds
 * @param bounds    the forecast distribution as fetched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Snapshot(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("bounds") ProbabilityDistribution bounds
) {}
