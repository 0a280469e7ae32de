package com.marketfeed.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.common.exception.FetchException;
import com.marketfeed.common.model.ConsolidatedPrediction;
import com.marketfeed.common.model.ConsolidatedPrediction.MinerPrice;
import com.marketfeed.common.model.ProbabilityDistribution;
import com.marketfeed.marketdata.provider.ForecastProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Synth forecast API. Every request carries {@code Authorization: Apikey <key>}.
 *
 * <p>Non-2xx responses become {@link FetchException} with the status and body text;
 * connection failures become {@link FetchException} without a status.
 */
public class SynthApiClient implements ForecastProvider {

    private static final Logger log = LoggerFactory.getLogger(SynthApiClient.class);

    static final int TOP_MINERS         = 3;
    static final int TIME_INCREMENT_SEC = 300;
    static final int TIME_LENGTH_SEC    = 86_400;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public SynthApiClient(WebClient synthWebClient, ObjectMapper objectMapper, String apiKey) {
        this.webClient    = synthWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Synth API key not configured, forecast requests will be rejected upstream");
        }
    }

    @Override
    public Mono<ProbabilityDistribution> fetchBounds(String asset) {
        String resource = "lp-bounds:" + asset;
        log.info("Fetching LP bounds. asset={}", asset);
        return get(resource, b -> b.path("/insights/lp-bounds-chart").queryParam("asset", asset).build())
            .map(json -> parse(resource, json, ProbabilityDistribution.class))
            .doOnNext(d -> log.info("LP bounds fetched. asset={} currentPrice={}", asset, d.currentPrice()));
    }

    @Override
    public Mono<List<ConsolidatedPrediction>> fetchConsolidatedPredictions(String asset) {
        String resource = "predictions:" + asset;
        return get(resource, b -> b.path("/validation/scores/latest").queryParam("asset", asset).build())
            .map(json -> topMiners(resource, json))
            .flatMap(ranks -> get(resource, b -> b.path("/prediction/latest")
                        .queryParam("miner", ranks.keySet().toArray())
                        .queryParam("asset", asset)
                        .queryParam("time_increment", TIME_INCREMENT_SEC)
                        .queryParam("time_length", TIME_LENGTH_SEC)
                        .build())
                .map(json -> consolidate(resource, json, ranks)))
            .doOnNext(points -> log.info("Predictions fetched. asset={} timePoints={}", asset, points.size()));
    }

    // ── transport ─────────────────────────────────────────────────────────────

    private Mono<String> get(String resource, Function<UriBuilder, URI> uri) {
        return webClient.get()
            .uri(uri)
            .header(HttpHeaders.AUTHORIZATION, "Apikey " + apiKey)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new FetchException(resource, response.statusCode().value(), body)))
            .bodyToMono(String.class)
            .onErrorMap(WebClientRequestException.class,
                        e -> new FetchException(resource, "Request failed: " + e.getMessage(), e));
    }

    private <T> T parse(String resource, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            throw new FetchException(resource, "Unparseable response", e);
        }
    }

    private JsonNode tree(String resource, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new FetchException(resource, "Unparseable response", e);
        }
    }

    // ── predictions ───────────────────────────────────────────────────────────

    /** Miner uid → rank for the best {@value #TOP_MINERS} entries; scores arrive best first. */
    Map<Long, Integer> topMiners(String resource, String json) {
        JsonNode root = tree(resource, json);
        if (!root.isArray()) {
            throw new FetchException(resource, "Validation scores are not an array");
        }
        Map<Long, Integer> ranks = new LinkedHashMap<>();
        for (JsonNode miner : root) {
            if (ranks.size() == TOP_MINERS) {
                break;
            }
            JsonNode uid = firstPresent(miner, "miner_uid", "neuron_uid", "uid");
            if (uid != null) {
                ranks.put(uid.asLong(), ranks.size() + 1);
            }
        }
        if (ranks.isEmpty()) {
            throw new FetchException(resource, "No miners in validation scores");
        }
        return ranks;
    }

    /** Merges per-miner price paths into one list of time points, oldest first. */
    List<ConsolidatedPrediction> consolidate(String resource, String json, Map<Long, Integer> ranks) {
        JsonNode root = tree(resource, json);
        if (!root.isArray()) {
            throw new FetchException(resource, "Predictions are not an array");
        }
        Map<String, List<MinerPrice>> byTime = new LinkedHashMap<>();
        for (JsonNode minerPrediction : root) {
            long uid = minerPrediction.path("miner_uid").asLong(-1);
            Integer rank = ranks.get(uid);
            JsonNode path = minerPrediction.path("prediction").path(0);
            if (rank == null || !path.isArray()) {
                log.warn("Skipping prediction entry. resource={} minerUid={}", resource, uid);
                continue;
            }
            for (JsonNode point : path) {
                if (!point.hasNonNull("time") || !point.hasNonNull("price")) {
                    continue;
                }
                byTime.computeIfAbsent(point.get("time").asText(), t -> new ArrayList<>())
                      .add(new MinerPrice(uid, rank, point.get("price").asDouble()));
            }
        }
        List<ConsolidatedPrediction> consolidated = new ArrayList<>();
        byTime.forEach((time, prices) -> consolidated.add(new ConsolidatedPrediction(time, prices)));
        consolidated.sort(Comparator.comparing(p -> pointTime(resource, p.time())));
        if (consolidated.isEmpty()) {
            throw new FetchException(resource, "No usable prediction points");
        }
        return consolidated;
    }

    /** Point times come as ISO instants; a missing offset is read as UTC. */
    private static Instant pointTime(String resource, String time) {
        try {
            return Instant.parse(time);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(time).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException again) {
                throw new FetchException(resource, "Unparseable prediction time: " + time, again);
            }
        }
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.hasNonNull(field)) {
                return node.get(field);
            }
        }
        return null;
    }
}
