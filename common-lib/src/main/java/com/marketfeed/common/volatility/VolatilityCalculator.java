package com.marketfeed.common.volatility;

import com.marketfeed.common.model.Candle;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Annualised close-to-close volatility from OHLC bars.
 *
 * <pre>
 *   r_i   = ln(close_i / close_{i-1})          bars sorted oldest first
 *   sigma = sample stddev of r (N − 1)
 *   vol   = sigma × sqrt(periodsPerYear) × 100  (percent)
 * </pre>
 *
 * <p>Pure static utility.
 */
public final class VolatilityCalculator {

    private static final Map<String, Integer> PERIODS_PER_YEAR = Map.of(
        "1m",  60 * 24 * 365,
        "5m",  12 * 24 * 365,
        "15m", 4 * 24 * 365,
        "1h",  24 * 365,
        "4h",  6 * 365,
        "1d",  365
    );

    private VolatilityCalculator() {}

    /**
     * @param period GMX candle period ({@code 1m, 5m, 15m, 1h, 4h, 1d})
     * @throws IllegalArgumentException for an unknown period
     */
    public static int periodsPerYear(String period) {
        Integer periods = PERIODS_PER_YEAR.get(period);
        if (periods == null) {
            throw new IllegalArgumentException("Unsupported candle period: " + period);
        }
        return periods;
    }

    /** @return annualised volatility in percent; 0 with fewer than two log returns */
    public static double annualizedVolatility(List<Candle> candles, String period) {
        if (candles == null || candles.size() < 2) {
            return 0.0;
        }
        double[] closes = candles.stream()
            .sorted(Comparator.comparingLong(Candle::timestamp))
            .mapToDouble(Candle::close)
            .filter(close -> close > 0)
            .toArray();
        if (closes.length < 3) {
            // a single return has no sample variance
            return 0.0;
        }

        double[] returns = new double[closes.length - 1];
        double sum = 0;
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = Math.log(closes[i] / closes[i - 1]);
            sum += returns[i - 1];
        }
        double mean = sum / returns.length;
        double squared = 0;
        for (double r : returns) {
            squared += (r - mean) * (r - mean);
        }
        double stdDev = Math.sqrt(squared / (returns.length - 1));
        return stdDev * Math.sqrt(periodsPerYear(period)) * 100.0;
    }
}
