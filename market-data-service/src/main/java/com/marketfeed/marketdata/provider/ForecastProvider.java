package com.marketfeed.marketdata.provider;

import com.marketfeed.common.model.ConsolidatedPrediction;
import com.marketfeed.common.model.ProbabilityDistribution;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Probabilistic price forecasts for an asset. The bounds endpoint is rate limited; callers
 * route it through a cooldown gate.
 */
public interface ForecastProvider {

    /** Probability-above/below curves for the next 24h plus the upstream's current price. */
    Mono<ProbabilityDistribution> fetchBounds(String asset);

    /** Latest price paths of the top-ranked forecasters, merged per time point. */
    Mono<List<ConsolidatedPrediction>> fetchConsolidatedPredictions(String asset);
}
