package com.marketfeed.marketdata.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Market and token tables as returned together by the protocol gateway. Both payloads are
 * opaque; they are only handed back to the gateway when positions are requested.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketsInfo(
    @JsonProperty("marketsInfoData") JsonNode marketsInfoData,
    @JsonProperty("tokensData")      JsonNode tokensData
) {}
