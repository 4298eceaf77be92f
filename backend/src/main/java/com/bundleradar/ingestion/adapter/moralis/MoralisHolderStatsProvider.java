package com.bundleradar.ingestion.adapter.moralis;

import com.bundleradar.config.CaffeineConfig;
import com.bundleradar.domain.Chain;
import com.bundleradar.domain.HolderStats;
import com.bundleradar.ingestion.adapter.HolderStatsProvider;
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

import java.util.Map;
import java.util.Optional;

/**
 * Holder distribution from Moralis: the Solana gateway for SOLANA, the ERC-20 deep-index API for EVM chains.
 * SHIBARIUM has no Moralis coverage and yields empty.
 */
@Slf4j
@Component
public class MoralisHolderStatsProvider implements HolderStatsProvider {

    private static final Map<Chain, String> EVM_CHAIN_IDS = Map.of(
            Chain.ETHEREUM, "eth",
            Chain.BASE, "base",
            Chain.BSC, "bsc"
    );

    private final RateLimitedHttpClient httpClient;
    private final ProviderProperties properties;

    public MoralisHolderStatsProvider(@Qualifier(ProviderConfig.MORALIS_CLIENT) RateLimitedHttpClient httpClient,
                                      ProviderProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.HOLDER_STATS_CACHE, key = "#chain.name() + ':' + #tokenAddress",
            unless = "#result == null")
    public Optional<HolderStats> fetch(Chain chain, String tokenAddress) {
        Optional<String> url = holdersUrl(chain, tokenAddress);
        if (url.isEmpty()) {
            log.debug("No Moralis holder coverage for chain {}", chain);
            return Optional.empty();
        }
        String apiKey = properties.getMoralis().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Moralis API key not configured; skipping holder data for {}", tokenAddress);
            return Optional.empty();
        }
        Optional<HolderStats> stats = parseHolderStats(httpClient.getJson(url.get(), Map.of("X-API-Key", apiKey)), chain);
        stats.ifPresent(s -> log.info("Holder data for {}: {} holders, top10 {}%", tokenAddress,
                s.totalHolders(), s.top10ConcentrationPct()));
        return stats;
    }

    Optional<String> holdersUrl(Chain chain, String tokenAddress) {
        ProviderProperties.Moralis moralis = properties.getMoralis();
        if (chain == Chain.SOLANA) {
            return Optional.of(UriComponentsBuilder.fromHttpUrl(moralis.getBaseUrl())
                    .pathSegment("token", "mainnet", "holders", tokenAddress)
                    .encode().toUriString());
        }
        String chainId = EVM_CHAIN_IDS.get(chain);
        if (chainId == null) {
            return Optional.empty();
        }
        return Optional.of(UriComponentsBuilder.fromHttpUrl(moralis.getEvmBaseUrl())
                .pathSegment("erc20", tokenAddress, "holders")
                .queryParam("chain", chainId)
                .encode().toUriString());
    }

    /**
     * Parses {@code totalHolders}, {@code holderSupply.top10.supplyPercent} and
     * {@code holderChange.24h.changePercent} (falling back to {@code change}). Empty for a null/non-object body.
     */
    public static Optional<HolderStats> parseHolderStats(JsonNode root, Chain chain) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        Double total = TransactionNormalizer.number(root.get("totalHolders"));
        Double top10 = TransactionNormalizer.number(root.path("holderSupply").path("top10").get("supplyPercent"));
        JsonNode change24h = root.path("holderChange").path("24h");
        Double change = TransactionNormalizer.number(change24h.get("changePercent"));
        if (change == null) {
            change = TransactionNormalizer.number(change24h.get("change"));
        }
        long totalHolders = total == null ? 0L : Math.max(0L, total.longValue());
        return Optional.of(new HolderStats(totalHolders, top10, change, chain));
    }
}
