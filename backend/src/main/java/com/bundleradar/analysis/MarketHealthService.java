package com.bundleradar.analysis;

import com.bundleradar.analysis.config.AnalysisProperties;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.MarketHealthResult;
import com.bundleradar.ingestion.adapter.OhlcvProvider;
import com.bundleradar.risk.MarketHealthAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Market health over the trailing window ending now. Independent of bundle detection; an upstream failure
 * yields an unavailable result rather than an exception.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketHealthService {

    private static final long SECONDS_PER_HOUR = 3_600L;

    private final OhlcvProvider ohlcvProvider;
    private final MarketHealthAnalyzer marketHealthAnalyzer;
    private final AnalysisProperties analysisProperties;

    public MarketHealthResult assess(String tokenAddress) {
        return assess(tokenAddress, Instant.now().getEpochSecond());
    }

    MarketHealthResult assess(String tokenAddress, long now) {
        if (tokenAddress == null || tokenAddress.isBlank()) {
            throw new IllegalArgumentException("tokenAddress must not be blank");
        }
        long from = now - analysisProperties.getMarketHealthWindowHours() * SECONDS_PER_HOUR;
        List<Candle> candles;
        try {
            candles = ohlcvProvider.fetch(tokenAddress, from, now, analysisProperties.getMarketHealthGranularity());
        } catch (RuntimeException e) {
            log.warn("Market health candles unavailable for {}", tokenAddress, e);
            return MarketHealthResult.unavailable(0, "Market health data unavailable: " + e.getMessage());
        }
        MarketHealthResult result = marketHealthAnalyzer.analyze(candles);
        log.info("Market health for {}: {} (score {}, {} candles)", tokenAddress,
                result.getMarketHealth() != null ? result.getMarketHealth() : "n/a",
                result.getSentimentScore(), result.getDataPoints());
        return result;
    }
}
