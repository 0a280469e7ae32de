package com.marketfeed.marketdata.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketfeed.common.model.ConsolidatedPrediction;
import com.marketfeed.common.model.PredictionPercentiles;
import com.marketfeed.common.model.PredictionTrend;
import com.marketfeed.common.model.ProbabilityDistribution;
import com.marketfeed.common.percentile.PredictionPercentileCalculator;
import com.marketfeed.common.volatility.VolatilityCalculator;
import com.marketfeed.marketdata.cache.FreshValueCache;
import com.marketfeed.marketdata.cache.ResourceClass;
import com.marketfeed.marketdata.cache.ResourceKey;
import com.marketfeed.marketdata.gate.CooldownGate;
import com.marketfeed.marketdata.provider.CandleProvider;
import com.marketfeed.marketdata.provider.ForecastProvider;
import com.marketfeed.marketdata.provider.GmxGateway;
import com.marketfeed.marketdata.provider.MarketsInfo;
import com.marketfeed.marketdata.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for every cached market resource.
 *
 * <p><strong>Flow per resource:</strong>
 * <ol>
 *   <li>{@link FreshValueCache} serves the value while it is younger than its class TTL.</li>
 *   <li>On a miss the upstream provider is called once, however many callers are waiting.</li>
 *   <li>LP-bounds fetches additionally pass the {@link CooldownGate} and, on success, append
 *       one snapshot to the {@link SnapshotStore}. Cache hits append nothing.</li>
 * </ol>
 *
 * <p>Positions depend on markets: a positions refresh reuses the cached markets value, or
 * fetches it first.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final FreshValueCache cache;
    private final CooldownGate lpBoundsGate;
    private final SnapshotStore snapshotStore;
    private final GmxGateway gmx;
    private final CandleProvider candles;
    private final ForecastProvider forecasts;

    @Value("${market-feed.volatility.period:15m}")
    private String volatilityPeriod = "15m";

    @Value("${market-feed.volatility.candle-limit:96}")
    private int volatilityCandleLimit = 96;

    public MarketDataService(FreshValueCache cache, CooldownGate lpBoundsGate, SnapshotStore snapshotStore,
                             GmxGateway gmx, CandleProvider candles, ForecastProvider forecasts) {
        this.cache         = cache;
        this.lpBoundsGate  = lpBoundsGate;
        this.snapshotStore = snapshotStore;
        this.gmx           = gmx;
        this.candles       = candles;
        this.forecasts     = forecasts;
    }

    // ── protocol tables ───────────────────────────────────────────────────────

    public Mono<MarketsInfo> getMarketsInfo(boolean forceRefresh) {
        return cache.get(ResourceKey.of(ResourceClass.MARKETS), gmx::fetchMarkets, forceRefresh);
    }

    public Mono<JsonNode> getTokensData(boolean forceRefresh) {
        return cache.get(ResourceKey.of(ResourceClass.TOKENS), gmx::fetchTokens, forceRefresh);
    }

    public Mono<JsonNode> getPositions(boolean forceRefresh) {
        return getMarketsInfo(false).flatMap(markets -> getPositions(markets, forceRefresh));
    }

    /** Positions against caller-supplied market tables. */
    public Mono<JsonNode> getPositions(MarketsInfo markets, boolean forceRefresh) {
        return cache.get(ResourceKey.of(ResourceClass.POSITIONS),
            () -> gmx.fetchPositions(markets.marketsInfoData(), markets.tokensData()), forceRefresh);
    }

    public Mono<JsonNode> getPositionsInfo(boolean forceRefresh) {
        return getMarketsInfo(false).flatMap(markets -> getPositionsInfo(markets, forceRefresh));
    }

    public Mono<JsonNode> getPositionsInfo(MarketsInfo markets, boolean forceRefresh) {
        return cache.get(ResourceKey.of(ResourceClass.POSITIONS_INFO),
            () -> gmx.fetchPositionsInfo(markets.marketsInfoData(), markets.tokensData()), forceRefresh);
    }

    // ── per-asset resources ───────────────────────────────────────────────────

    /** Annualised volatility in percent over the configured candle window. */
    public Mono<Double> getVolatility(String asset, boolean forceRefresh) {
        ResourceKey key = ResourceKey.forAsset(ResourceClass.VOLATILITY, asset);
        return cache.get(key, () -> candles.fetchCandles(key.asset(), volatilityPeriod, volatilityCandleLimit)
            .map(bars -> {
                double volatility = VolatilityCalculator.annualizedVolatility(bars, volatilityPeriod);
                log.info("VOLATILITY_COMPUTED asset={} period={} candles={} volatility={}",
                         key.asset(), volatilityPeriod, bars.size(), volatility);
                return volatility;
            }), forceRefresh);
    }

    /**
     * LP-bounds forecast for {@code asset}. Upstream calls are spaced by the cooldown gate and
     * every successful call is recorded as a snapshot.
     */
    public Mono<ProbabilityDistribution> getLpBounds(String asset, boolean forceRefresh) {
        ResourceKey key = ResourceKey.forAsset(ResourceClass.LP_BOUNDS, asset);
        return cache.get(key, () -> lpBoundsGate.guard(() -> forecasts.fetchBounds(key.asset()))
            .doOnNext(bounds -> snapshotStore.append(key.asset(), bounds)), forceRefresh);
    }

    public Mono<List<ConsolidatedPrediction>> getPredictions(String asset, boolean forceRefresh) {
        ResourceKey key = ResourceKey.forAsset(ResourceClass.PREDICTIONS, asset);
        return cache.get(key, () -> forecasts.fetchConsolidatedPredictions(key.asset()), forceRefresh);
    }

    /** Hourly percentile bands of the cached predictions, ranked against {@code currentPrice}. */
    public Mono<PredictionPercentiles> getPredictionPercentiles(String asset, double currentPrice) {
        return getPredictions(asset, false)
            .map(points -> PredictionPercentileCalculator.calculate(points, currentPrice));
    }

    public Mono<PredictionTrend> getPredictionTrend(String asset, double currentPrice) {
        return getPredictionPercentiles(asset, currentPrice)
            .map(percentiles -> PredictionPercentileCalculator.detectTrend(percentiles.bands()));
    }

    // ── cache administration ──────────────────────────────────────────────────

    public void invalidate(ResourceClass resourceClass) {
        cache.invalidate(resourceClass);
    }

    public void invalidate(ResourceKey key) {
        cache.invalidate(key);
    }

    /** Positions and positions info always go stale together. */
    public void invalidatePositions() {
        cache.invalidate(ResourceClass.POSITIONS);
        cache.invalidate(ResourceClass.POSITIONS_INFO);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public Map<String, Boolean> getCacheStatus() {
        return cache.getCacheStatus();
    }

    public Map<String, Duration> getCacheAges() {
        return cache.getCacheAges();
    }
}
