package com.bundleradar.ingestion.adapter.birdeye;

import com.bundleradar.config.CaffeineConfig;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.Chain;
import com.bundleradar.ingestion.adapter.OhlcvProvider;
import com.bundleradar.ingestion.adapter.RateLimitedHttpClient;
import com.bundleradar.ingestion.config.ProviderConfig;
import com.bundleradar.ingestion.config.ProviderProperties;
import com.bundleradar.ingestion.normalizer.TransactionNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * USD candles from BirdEye {@code /defi/v3/ohlcv}. The x-chain header follows the address format.
 */
@Slf4j
@Component
public class BirdeyeOhlcvProvider implements OhlcvProvider {

    private final RateLimitedHttpClient httpClient;
    private final ProviderProperties properties;

    public BirdeyeOhlcvProvider(@Qualifier(ProviderConfig.BIRDEYE_CLIENT) RateLimitedHttpClient httpClient,
                                ProviderProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.OHLCV_CACHE,
            key = "#tokenAddress + '-' + #timeFrom + '-' + #timeTo + '-' + #granularity")
    public List<Candle> fetch(String tokenAddress, long timeFrom, long timeTo, String granularity) {
        if (!BirdeyeHeaders.hasApiKey(properties)) {
            log.warn("BirdEye API key not configured; skipping OHLCV for {}", tokenAddress);
            return List.of();
        }
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBirdeye().getBaseUrl())
                .path("/defi/v3/ohlcv")
                .queryParam("address", tokenAddress)
                .queryParam("type", granularity)
                .queryParam("currency", "usd")
                .queryParam("time_from", timeFrom)
                .queryParam("time_to", timeTo)
                .queryParam("ui_amount_mode", "raw")
                .encode().toUriString();
        String chain = Chain.detect(tokenAddress).name().toLowerCase(Locale.ROOT);
        List<Candle> candles = parseCandles(httpClient.getJson(url, BirdeyeHeaders.of(properties, chain)));
        log.info("Fetched {} {} candles for {}", candles.size(), granularity, tokenAddress);
        return candles;
    }

    /**
     * Parses {@code data.items[]} with {@code o,h,l,c,v_usd,unix_time}; items without a close or time are dropped.
     * Result is ascending by time.
     */
    public static List<Candle> parseCandles(JsonNode root) {
        JsonNode items = root == null ? null : root.path("data").get("items");
        if (items == null || !items.isArray()) {
            return List.of();
        }
        List<Candle> candles = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Double time = TransactionNormalizer.number(item.get("unix_time"));
            Double close = TransactionNormalizer.number(item.get("c"));
            if (time == null || close == null) {
                continue;
            }
            candles.add(new Candle(time.longValue(),
                    orZero(TransactionNormalizer.number(item.get("o"))),
                    orZero(TransactionNormalizer.number(item.get("h"))),
                    orZero(TransactionNormalizer.number(item.get("l"))),
                    close,
                    orZero(TransactionNormalizer.number(item.get("v_usd")))));
        }
        candles.sort(Comparator.comparingLong(Candle::unixTime));
        return List.copyOf(candles);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
