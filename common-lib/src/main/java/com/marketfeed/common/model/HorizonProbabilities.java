package com.marketfeed.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probability curves for one forecast horizon, keyed by price level as sent on the wire
 * (price strings, e.g. {@code "65000"} or {@code "65000.5"}).
 *
 * <p>{@code probabilityBelow[p]} is the forecast probability that the price ends the horizon
 * below {@code p}; {@code probabilityAbove[p]} the probability that it ends above.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HorizonProbabilities(
    @JsonProperty("probability_above") Map<String, Double> probabilityAbove,
    @JsonProperty("probability_below") Map<String, Double> probabilityBelow
) {
    public HorizonProbabilities {
        probabilityAbove = probabilityAbove == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(probabilityAbove));
        probabilityBelow = probabilityBelow == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(probabilityBelow));
    }

    public static HorizonProbabilities ofBelow(Map<String, Double> probabilityBelow) {
        return new HorizonProbabilities(Map.of(), probabilityBelow);
    }
}
