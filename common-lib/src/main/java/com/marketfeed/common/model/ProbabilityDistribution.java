package com.marketfeed.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LP-bounds forecast as returned by the Synth {@code lp-bounds-chart} insight:
 * <pre>
 *   { "data": { "24h": { "probability_above": {...}, "probability_below": {...} } },
 *     "current_price": 65012.4 }
 * </pre>
 *
 * <p>Immutable. Stored verbatim inside each {@link Snapshot} so the persisted document keeps
 * the upstream shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbabilityDistribution(
    @JsonProperty("data") Map<String, HorizonProbabilities> data,
    @JsonProperty("current_price") Double currentPrice
) {
    public static final String HORIZON_24H = "24h";

    public ProbabilityDistribution {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** Convenience factory for a single 24h horizon. */
    public static ProbabilityDistribution of24h(HorizonProbabilities horizon, Double currentPrice) {
        return new ProbabilityDistribution(Map.of(HORIZON_24H, horizon), currentPrice);
    }

    /** @return the curves for {@code horizon}, or {@code null} when the forecast does not carry it */
    public HorizonProbabilities horizon(String horizon) {
        return data.get(horizon);
    }
}
