package com.marketfeed.marketdata.controller;

import com.marketfeed.common.model.PercentileAnalysis;
import com.marketfeed.common.model.PredictionPercentiles;
import com.marketfeed.common.model.PredictionTrend;
import com.marketfeed.marketdata.cache.ResourceClass;
import com.marketfeed.marketdata.service.MarketDataService;
import com.marketfeed.marketdata.service.PercentileAnalysisService;
import com.marketfeed.marketdata.snapshot.DataSufficiency;
import com.marketfeed.marketdata.snapshot.PersistenceStatus;
import com.marketfeed.marketdata.snapshot.SnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private final MarketDataService marketDataService;
    private final PercentileAnalysisService percentileService;
    private final SnapshotStore snapshotStore;

    public MarketDataController(MarketDataService marketDataService,
                                PercentileAnalysisService percentileService,
                                SnapshotStore snapshotStore) {
        this.marketDataService = marketDataService;
        this.percentileService = percentileService;
        this.snapshotStore     = snapshotStore;
    }

    @GetMapping("/cache/status")
    public Map<String, Object> cacheStatus() {
        Map<String, Long> agesMs = new LinkedHashMap<>();
        marketDataService.getCacheAges().forEach((key, age) -> agesMs.put(key, age.toMillis()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fresh", marketDataService.getCacheStatus());
        body.put("agesMs", agesMs);
        return body;
    }

    /** Drops cached values of one resource class, or of every class when none is given. */
    @PostMapping("/cache/invalidate")
    public ResponseEntity<Void> invalidate(@RequestParam(required = false) String resource) {
        if (resource == null || resource.isBlank()) {
            marketDataService.invalidateAll();
        } else {
            marketDataService.invalidate(ResourceClass.fromName(resource));
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/volatility/{asset}")
    public Mono<Map<String, Object>> volatility(@PathVariable String asset) {
        return marketDataService.getVolatility(asset, false)
            .map(volatility -> Map.<String, Object>of("asset", asset.toUpperCase(), "volatility", volatility));
    }

    /**
     * Percentile analysis at {@code price}; without a price the current price of the latest
     * LP-bounds forecast is used.
     */
    @GetMapping("/percentiles/{asset}")
    public Mono<PercentileAnalysis> percentiles(@PathVariable String asset,
                                                @RequestParam(required = false) Double price) {
        Mono<Double> resolvedPrice = price != null
            ? Mono.just(price)
            : marketDataService.getLpBounds(asset, false)
                .flatMap(bounds -> Mono.justOrEmpty(bounds.currentPrice()))
                .switchIfEmpty(Mono.error(() ->
                    new IllegalArgumentException("price is required, no current price known for " + asset)));
        return resolvedPrice.map(p -> percentileService.analyze(asset.toUpperCase(), p));
    }

    @GetMapping("/predictions/{asset}/percentiles")
    public Mono<PredictionPercentiles> predictionPercentiles(@PathVariable String asset,
                                                             @RequestParam double price) {
        return marketDataService.getPredictionPercentiles(asset, price);
    }

    @GetMapping("/predictions/{asset}/trend")
    public Mono<PredictionTrend> predictionTrend(@PathVariable String asset, @RequestParam double price) {
        return marketDataService.getPredictionTrend(asset, price);
    }

    @GetMapping("/snapshots/{asset}/sufficiency")
    public DataSufficiency sufficiency(@PathVariable String asset,
                                       @RequestParam(defaultValue = "10") int minCount,
                                       @RequestParam(defaultValue = "24") long minHours) {
        return percentileService.sufficiency(asset, minCount, Duration.ofHours(minHours));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        PersistenceStatus persistence = snapshotStore.getPersistenceStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", persistence.healthy() ? "OK" : "DEGRADED");
        body.put("persistence", persistence);
        body.put("snapshots", snapshotStore.counts());
        return body;
    }
}
