package com.marketfeed.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.common.exception.FetchException;
import com.marketfeed.marketdata.provider.GmxGateway;
import com.marketfeed.marketdata.provider.MarketsInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link GmxGateway} backed by the protocol SDK running as an HTTP sidecar.
 *
 * <pre>
 *   GET  /markets         → { marketsInfoData, tokensData }
 *   GET  /tokens          → { tokensData }
 *   POST /positions       ← { marketsInfoData, tokensData }  → positions
 *   POST /positions-info  ← { marketsInfoData, tokensData }  → positions info
 * </pre>
 */
public class GmxSidecarClient implements GmxGateway {

    private static final Logger log = LoggerFactory.getLogger(GmxSidecarClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GmxSidecarClient(WebClient gmxSidecarWebClient, ObjectMapper objectMapper) {
        this.webClient    = gmxSidecarWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<MarketsInfo> fetchMarkets() {
        return get("markets", "/markets")
            .map(root -> {
                if (!root.hasNonNull("marketsInfoData") || !root.hasNonNull("tokensData")) {
                    throw new FetchException("markets", "Response lacks marketsInfoData or tokensData");
                }
                return new MarketsInfo(root.get("marketsInfoData"), root.get("tokensData"));
            });
    }

    @Override
    public Mono<JsonNode> fetchTokens() {
        return get("tokens", "/tokens")
            .map(root -> {
                JsonNode tokens = root.path("tokensData");
                if (tokens.isMissingNode() || tokens.isNull()) {
                    throw new FetchException("tokens", "Response lacks tokensData");
                }
                return tokens;
            });
    }

    @Override
    public Mono<JsonNode> fetchPositions(JsonNode marketsInfoData, JsonNode tokensData) {
        return post("positions", "/positions", marketsInfoData, tokensData);
    }

    @Override
    public Mono<JsonNode> fetchPositionsInfo(JsonNode marketsInfoData, JsonNode tokensData) {
        return post("positions-info", "/positions-info", marketsInfoData, tokensData);
    }

    // ── transport ─────────────────────────────────────────────────────────────

    private Mono<JsonNode> get(String resource, String path) {
        log.info("Fetching from GMX sidecar. resource={}", resource);
        return exchange(resource, webClient.get().uri(path).retrieve());
    }

    private Mono<JsonNode> post(String resource, String path, JsonNode marketsInfoData, JsonNode tokensData) {
        Map<String, JsonNode> body = new LinkedHashMap<>();
        body.put("marketsInfoData", marketsInfoData);
        body.put("tokensData", tokensData);
        log.info("Fetching from GMX sidecar. resource={}", resource);
        return exchange(resource, webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve());
    }

    private Mono<JsonNode> exchange(String resource, WebClient.ResponseSpec response) {
        return response
            .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> new FetchException(resource, r.statusCode().value(), text)))
            .bodyToMono(String.class)
            .onErrorMap(WebClientRequestException.class,
                        e -> new FetchException(resource, "Sidecar unreachable: " + e.getMessage(), e))
            .map(json -> {
                try {
                    return objectMapper.readTree(json);
                } catch (Exception e) {
                    throw new FetchException(resource, "Unparseable sidecar response", e);
                }
            });
    }
}
