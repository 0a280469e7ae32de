package com.marketfeed.marketdata.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketfeed.common.model.Snapshot;

import java.util.List;
import java.util.Map;

/**
 * Durable layout of the snapshot store:
 * <pre>
 *   { "version": "1.0", "snapshots": { "BTC": [ {timestamp, bounds}, ... ], "ETH": [...] } }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
    @JsonProperty("version") String version,
    @JsonProperty("snapshots") Map<String, List<Snapshot>> snapshots
) {}
