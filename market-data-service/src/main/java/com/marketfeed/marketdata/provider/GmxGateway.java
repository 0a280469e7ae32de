package com.marketfeed.marketdata.provider;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Boundary to the perpetuals protocol SDK. Implementations return the SDK payloads untouched;
 * an empty {@link Mono} is treated as a failed fetch by the cache.
 */
public interface GmxGateway {

    Mono<MarketsInfo> fetchMarkets();

    Mono<JsonNode> fetchTokens();

    Mono<JsonNode> fetchPositions(JsonNode marketsInfoData, JsonNode tokensData);

    Mono<JsonNode> fetchPositionsInfo(JsonNode marketsInfoData, JsonNode tokensData);
}
