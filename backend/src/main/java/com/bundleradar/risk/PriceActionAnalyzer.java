package com.bundleradar.risk;

import com.bundleradar.common.Statistics;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.LargeDrop;
import com.bundleradar.domain.MitigationFactor;
import com.bundleradar.domain.PriceActionResult;
import com.bundleradar.domain.SelloffSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Looks for evidence that bundled supply was dumped after launch: decline from the window peak,
 * large single-candle drops and high-volume red candles. A severe crash lowers forward risk for new
 * buyers, reported as the risk mitigation factor.
 */
@Component
public class PriceActionAnalyzer {

    static final double LARGE_DROP_PCT = -20.0;
    static final double HIGH_VOLUME_MULTIPLE = 2.0;
    static final double HIGH_VOLUME_SELLOFF_PCT = -10.0;

    public PriceActionResult analyze(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return PriceActionResult.unknown(0, "Insufficient OHLCV data for price action analysis");
        }
        List<Candle> sorted = candles.stream().sorted(Comparator.comparingLong(Candle::unixTime)).toList();

        double peak = sorted.stream().mapToDouble(Candle::high).max().orElse(0.0);
        if (peak <= 0) {
            return PriceActionResult.unknown(sorted.size(), "No valid price data found");
        }
        double current = sorted.get(sorted.size() - 1).close();
        double declinePct = (peak - current) / peak * 100.0;

        List<Double> ranges = new ArrayList<>();
        for (Candle c : sorted) {
            if (c.high() > 0 && c.low() > 0) {
                ranges.add((c.high() - c.low()) / c.low() * 100.0);
            }
        }
        double avgVolatility = Statistics.mean(ranges);
        double maxVolatility = ranges.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        List<LargeDrop> largeDrops = largeDrops(sorted);
        int highVolumeSelloffs = highVolumeSelloffs(sorted);

        SelloffSeverity severity = severity(declinePct);
        List<String> factors = new ArrayList<>();
        if (severity != SelloffSeverity.NONE) {
            factors.add(String.format(Locale.ROOT, "%s price decline from peak (%.1f%%)",
                    capitalize(severity), declinePct));
        }
        if (!largeDrops.isEmpty()) {
            factors.add(largeDrops.size() + " large single-day drops detected");
        }
        if (highVolumeSelloffs > 0) {
            factors.add(highVolumeSelloffs + " high-volume sell-off days");
        }
        boolean detected = severity != SelloffSeverity.NONE || !largeDrops.isEmpty() || highVolumeSelloffs > 0;

        return PriceActionResult.builder()
                .selloffDetected(detected)
                .selloffSeverity(severity)
                .priceDeclineFromPeakPct(Statistics.round(declinePct, 1))
                .peakPrice(peak)
                .currentPrice(current)
                .largeDropsCount(largeDrops.size())
                .largeDrops(largeDrops)
                .highVolumeSelloffs(highVolumeSelloffs)
                .avgDailyVolatilityPct(Statistics.round(avgVolatility, 1))
                .maxDailyVolatilityPct(Statistics.round(maxVolatility, 1))
                .riskMitigationFactor(mitigation(detected, severity))
                .riskFactors(List.copyOf(factors))
                .dataPoints(sorted.size())
                .analysisNote(String.format(Locale.ROOT, "Price action over %d candles shows %s sell-off pattern",
                        sorted.size(), severity.name().toLowerCase(Locale.ROOT)))
                .build();
    }

    static SelloffSeverity severity(double declinePct) {
        if (declinePct > 80) {
            return SelloffSeverity.EXTREME;
        }
        if (declinePct > 60) {
            return SelloffSeverity.SEVERE;
        }
        if (declinePct > 40) {
            return SelloffSeverity.MODERATE;
        }
        if (declinePct > 20) {
            return SelloffSeverity.MILD;
        }
        return SelloffSeverity.NONE;
    }

    static MitigationFactor mitigation(boolean detected, SelloffSeverity severity) {
        if (!detected) {
            return MitigationFactor.NONE;
        }
        return switch (severity) {
            case EXTREME, SEVERE -> MitigationFactor.HIGH;
            case MODERATE -> MitigationFactor.MEDIUM;
            default -> MitigationFactor.LOW;
        };
    }

    private static List<LargeDrop> largeDrops(List<Candle> sorted) {
        List<LargeDrop> drops = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            double prevClose = sorted.get(i - 1).close();
            if (prevClose <= 0) {
                continue;
            }
            double change = (sorted.get(i).close() - prevClose) / prevClose * 100.0;
            if (change < LARGE_DROP_PCT) {
                drops.add(new LargeDrop(i, Statistics.round(Math.abs(change), 1), sorted.get(i).unixTime()));
            }
        }
        return List.copyOf(drops);
    }

    /**
     * Candles with volume above twice the window mean that closed more than 10% below their open.
     */
    private static int highVolumeSelloffs(List<Candle> sorted) {
        double meanVolume = sorted.stream().mapToDouble(Candle::volumeUsd).average().orElse(0.0);
        if (meanVolume <= 0) {
            return 0;
        }
        int count = 0;
        for (Candle c : sorted) {
            if (c.volumeUsd() > meanVolume * HIGH_VOLUME_MULTIPLE && c.open() > 0) {
                double change = (c.close() - c.open()) / c.open() * 100.0;
                if (change < HIGH_VOLUME_SELLOFF_PCT) {
                    count++;
                }
            }
        }
        return count;
    }

    private static String capitalize(SelloffSeverity severity) {
        String name = severity.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
