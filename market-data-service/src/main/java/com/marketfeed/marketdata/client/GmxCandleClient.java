package com.marketfeed.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.common.exception.FetchException;
import com.marketfeed.common.model.Candle;
import com.marketfeed.marketdata.provider.CandleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * GMX public price API. {@code GET /prices/candles} answers
 * {@code {"period": "15m", "candles": [[ts, open, high, low, close], ...]}}, newest bar first.
 */
public class GmxCandleClient implements CandleProvider {

    private static final Logger log = LoggerFactory.getLogger(GmxCandleClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GmxCandleClient(WebClient gmxApiWebClient, ObjectMapper objectMapper) {
        this.webClient    = gmxApiWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<Candle>> fetchCandles(String asset, String period, int limit) {
        String resource = "candles:" + asset + ":" + period;
        log.info("Fetching candles. asset={} period={} limit={}", asset, period, limit);
        return webClient.get()
            .uri(b -> b.path("/prices/candles")
                .queryParam("tokenSymbol", asset)
                .queryParam("period", period)
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new FetchException(resource, response.statusCode().value(), body)))
            .bodyToMono(String.class)
            .onErrorMap(WebClientRequestException.class,
                        e -> new FetchException(resource, "Request failed: " + e.getMessage(), e))
            .map(json -> parseCandles(resource, json))
            .doOnNext(candles -> log.info("Candles fetched. asset={} period={} count={}",
                                             asset, period, candles.size()));
    }

    List<Candle> parseCandles(String resource, String json) {
        JsonNode rows;
        try {
            rows = objectMapper.readTree(json).path("candles");
        } catch (Exception e) {
            throw new FetchException(resource, "Unparseable response", e);
        }
        if (!rows.isArray()) {
            throw new FetchException(resource, "Response has no candles array");
        }
        List<Candle> candles = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < 5) {
                continue;
            }
            candles.add(new Candle(
                row.get(0).asLong(),
                row.get(1).asDouble(),
                row.get(2).asDouble(),
                row.get(3).asDouble(),
                row.get(4).asDouble()
            ));
        }
        return candles;
    }
}
