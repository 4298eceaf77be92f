package com.bundleradar.ingestion.adapter.birdeye;

import com.bundleradar.config.CaffeineConfig;
import com.bundleradar.domain.CreationInfo;
import com.bundleradar.ingestion.adapter.CreationInfoProvider;
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

import java.time.Instant;
import java.util.Optional;

/**
 * Token creation time from BirdEye {@code /defi/token_creation_info}. Creation data never changes, so hits are cached.
 */
@Slf4j
@Component
public class BirdeyeCreationInfoProvider implements CreationInfoProvider {

    private final RateLimitedHttpClient httpClient;
    private final ProviderProperties properties;

    public BirdeyeCreationInfoProvider(@Qualifier(ProviderConfig.BIRDEYE_CLIENT) RateLimitedHttpClient httpClient,
                                       ProviderProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.CREATION_INFO_CACHE, key = "#tokenAddress", unless = "#result == null")
    public Optional<CreationInfo> fetch(String tokenAddress) {
        if (!BirdeyeHeaders.hasApiKey(properties)) {
            log.warn("BirdEye API key not configured; creation info unavailable for {}", tokenAddress);
            return Optional.empty();
        }
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBirdeye().getBaseUrl())
                .path("/defi/token_creation_info")
                .queryParam("address", tokenAddress)
                .encode().toUriString();
        Optional<CreationInfo> info = parseCreationInfo(httpClient.getJson(url, BirdeyeHeaders.of(properties, "solana")));
        if (info.isEmpty()) {
            log.warn("No creation info returned for {}", tokenAddress);
        }
        return info;
    }

    /**
     * Parses {@code data.blockUnixTime}, {@code data.blockHumanTime} and {@code data.txHash}.
     * Empty when the block time is missing or not positive.
     */
    public static Optional<CreationInfo> parseCreationInfo(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }
        Double blockTime = TransactionNormalizer.number(data.get("blockUnixTime"));
        if (blockTime == null || blockTime <= 0) {
            return Optional.empty();
        }
        long blockUnixTime = blockTime.longValue();
        String human = data.path("blockHumanTime").asText("");
        String createdAt = human.isBlank() ? Instant.ofEpochSecond(blockUnixTime).toString() : human;
        return Optional.of(new CreationInfo(createdAt, data.path("txHash").asText(""), blockUnixTime));
    }
}
