package com.marketfeed.marketdata.provider;

import com.marketfeed.common.model.Candle;
import reactor.core.publisher.Mono;

import java.util.List;

public interface CandleProvider {

    /**
     * @param period candle width as the upstream names it ({@code 15m}, {@code 1h}, ...)
     * @param limit  maximum number of bars, newest first on the wire
     */
    Mono<List<Candle>> fetchCandles(String asset, String period, int limit);
}
