package com.bundleradar.risk;

import com.bundleradar.common.Statistics;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.MarketHealthLevel;
import com.bundleradar.domain.MarketHealthResult;
import com.bundleradar.domain.PressureDominance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores the last day of intraday candles:
 * <ul>
 *     <li>price change from first open to last close, up to 40 points</li>
 *     <li>share of green candles (buy pressure), up to 30 points</li>
 *     <li>second-half vs first-half volume, up to 20 points</li>
 *     <li>mean candle range (high - low) / low, up to 10 points for calm markets</li>
 * </ul>
 */
@Component
public class MarketHealthAnalyzer {

    public MarketHealthResult analyze(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return MarketHealthResult.unavailable(candles == null ? 0 : candles.size(),
                    "Insufficient 24h OHLCV data for market health analysis");
        }
        List<Candle> sorted = candles.stream().sorted(Comparator.comparingLong(Candle::unixTime)).toList();
        int n = sorted.size();

        double maxClose = sorted.stream().mapToDouble(Candle::close).max().orElse(0.0);
        if (maxClose <= 0) {
            return MarketHealthResult.unavailable(n, "No valid price data in 24h window");
        }

        double high = sorted.stream().mapToDouble(Candle::high).max().orElse(0.0);
        double low = sorted.stream().mapToDouble(Candle::low).min().orElse(0.0);
        double current = sorted.get(n - 1).close();
        double start = sorted.get(0).open();
        double priceChange = start > 0 ? (current - start) / start * 100.0 : 0.0;

        int green = 0;
        int red = 0;
        for (Candle c : sorted) {
            if (c.close() > c.open()) {
                green++;
            } else if (c.close() < c.open()) {
                red++;
            }
        }
        double buyPressure = 100.0 * green / n;
        double sellPressure = 100.0 * red / n;

        double totalVolume = sorted.stream().mapToDouble(Candle::volumeUsd).sum();
        double volumeChange = volumeChange(sorted);

        List<Double> ranges = new ArrayList<>();
        for (Candle c : sorted) {
            if (c.high() > 0 && c.low() > 0) {
                ranges.add((c.high() - c.low()) / c.low() * 100.0);
            }
        }
        double avgVolatility = Statistics.mean(ranges);

        List<String> factors = new ArrayList<>();
        int score = priceScore(priceChange, factors)
                + pressureScore(buyPressure, factors)
                + volumeScore(volumeChange, factors)
                + volatilityScore(avgVolatility, factors);
        MarketHealthLevel level = level(score);

        return MarketHealthResult.builder()
                .marketHealthAvailable(true)
                .marketHealth(level)
                .sentimentScore(score)
                .sentimentFactors(List.copyOf(factors))
                .priceChange24hPct(Statistics.round(priceChange, 2))
                .high24h(high)
                .low24h(low)
                .currentPrice(current)
                .buyPressurePct(Statistics.round(buyPressure, 1))
                .sellPressurePct(Statistics.round(sellPressure, 1))
                .pressureDominance(dominance(buyPressure, sellPressure))
                .totalVolume24hUsd(Statistics.round(totalVolume, 2))
                .avgVolumePerPeriodUsd(Statistics.round(totalVolume / n, 2))
                .volumeChangePct(Statistics.round(volumeChange, 1))
                .avgVolatilityPct(Statistics.round(avgVolatility, 1))
                .dataPoints(n)
                .analysisNote(String.format(Locale.ROOT, "24h market health: %s based on %d candles", level, n))
                .build();
    }

    /**
     * Percent change of the second half's volume over the first half's; 0 when the first half traded nothing.
     */
    static double volumeChange(List<Candle> sorted) {
        int mid = sorted.size() / 2;
        double firstHalf = 0.0;
        double secondHalf = 0.0;
        for (int i = 0; i < sorted.size(); i++) {
            if (i < mid) {
                firstHalf += sorted.get(i).volumeUsd();
            } else {
                secondHalf += sorted.get(i).volumeUsd();
            }
        }
        return firstHalf > 0 ? (secondHalf - firstHalf) / firstHalf * 100.0 : 0.0;
    }

    static PressureDominance dominance(double buyPressure, double sellPressure) {
        if (buyPressure > 60) {
            return PressureDominance.STRONG_BUY;
        }
        if (buyPressure > 55) {
            return PressureDominance.BUY;
        }
        if (sellPressure > 60) {
            return PressureDominance.STRONG_SELL;
        }
        if (sellPressure > 55) {
            return PressureDominance.SELL;
        }
        return PressureDominance.NEUTRAL;
    }

    static MarketHealthLevel level(int score) {
        if (score >= 75) {
            return MarketHealthLevel.EXCELLENT;
        }
        if (score >= 60) {
            return MarketHealthLevel.GOOD;
        }
        if (score >= 45) {
            return MarketHealthLevel.FAIR;
        }
        return MarketHealthLevel.LOW;
    }

    private static int priceScore(double change, List<String> factors) {
        if (change > 10) {
            factors.add(String.format(Locale.ROOT, "Strong price growth (%+.1f%%)", change));
            return 40;
        }
        if (change > 5) {
            factors.add(String.format(Locale.ROOT, "Positive price movement (%+.1f%%)", change));
            return 25;
        }
        if (change > 0) {
            factors.add(String.format(Locale.ROOT, "Slight price increase (%+.1f%%)", change));
            return 15;
        }
        if (change > -5) {
            factors.add(String.format(Locale.ROOT, "Minor price decline (%+.1f%%)", change));
            return 5;
        }
        factors.add(String.format(Locale.ROOT, "Significant price decline (%+.1f%%)", change));
        return 0;
    }

    private static int pressureScore(double buyPressure, List<String> factors) {
        if (buyPressure > 65) {
            factors.add(String.format(Locale.ROOT, "Dominant buy pressure (%.1f%%)", buyPressure));
            return 30;
        }
        if (buyPressure > 55) {
            factors.add(String.format(Locale.ROOT, "Strong buy pressure (%.1f%%)", buyPressure));
            return 20;
        }
        if (buyPressure > 45) {
            factors.add("Balanced buy/sell pressure");
            return 10;
        }
        return 0;
    }

    private static int volumeScore(double volumeChange, List<String> factors) {
        if (volumeChange > 50) {
            factors.add(String.format(Locale.ROOT, "Increasing volume trend (%+.1f%%)", volumeChange));
            return 20;
        }
        if (volumeChange > 0) {
            factors.add(String.format(Locale.ROOT, "Growing volume (%+.1f%%)", volumeChange));
            return 10;
        }
        if (volumeChange < -30) {
            factors.add(String.format(Locale.ROOT, "Declining volume (%+.1f%%)", volumeChange));
        }
        return 0;
    }

    private static int volatilityScore(double avgVolatility, List<String> factors) {
        if (avgVolatility < 5) {
            factors.add("Low volatility (stable)");
            return 10;
        }
        if (avgVolatility < 15) {
            factors.add("Moderate volatility");
            return 5;
        }
        factors.add("High volatility");
        return 0;
    }
}
