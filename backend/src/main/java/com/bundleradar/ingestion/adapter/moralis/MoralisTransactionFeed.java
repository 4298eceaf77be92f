package com.bundleradar.ingestion.adapter.moralis;

import com.bundleradar.domain.Transaction;
import com.bundleradar.ingestion.adapter.ProviderException;
import com.bundleradar.ingestion.adapter.RateLimitedHttpClient;
import com.bundleradar.ingestion.adapter.TransactionFeed;
import com.bundleradar.ingestion.config.ProviderConfig;
import com.bundleradar.ingestion.config.ProviderProperties;
import com.bundleradar.ingestion.normalizer.TransactionNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Earliest buys from the Moralis Solana swaps API. Cursor-paginated, so pages are fetched one after another.
 * A failure on the first page propagates; a later failure ends pagination with what was collected.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bundleradar.analysis.feed", havingValue = "MORALIS", matchIfMissing = true)
public class MoralisTransactionFeed implements TransactionFeed {

    private final RateLimitedHttpClient httpClient;
    private final ProviderProperties properties;

    public MoralisTransactionFeed(@Qualifier(ProviderConfig.MORALIS_CLIENT) RateLimitedHttpClient httpClient,
                                  ProviderProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public List<Transaction> fetch(String tokenAddress, long fromTime, int limit) {
        ProviderProperties.Moralis moralis = properties.getMoralis();
        if (limit <= 0) {
            return List.of();
        }
        if (moralis.getApiKey() == null || moralis.getApiKey().isBlank()) {
            log.warn("Moralis API key not configured; no transactions fetched for {}", tokenAddress);
            return List.of();
        }
        List<Transaction> collected = new ArrayList<>();
        int skipped = 0;
        int pages = 0;
        String cursor = null;
        while (collected.size() < limit) {
            int pageSize = Math.min(moralis.getPageSize(), limit - collected.size());
            SwapPage page;
            try {
                page = parseSwapPage(httpClient.getJson(swapsUrl(tokenAddress, fromTime, pageSize, cursor), headers()));
            } catch (ProviderException e) {
                if (pages == 0) {
                    throw e;
                }
                log.warn("Moralis swaps page {} failed for {}; keeping {} transactions", pages, tokenAddress,
                        collected.size(), e);
                break;
            }
            pages++;
            if (page.records() == 0) {
                break;
            }
            collected.addAll(page.transactions());
            skipped += page.skipped();
            cursor = page.cursor();
            if (cursor == null || page.records() < pageSize) {
                break;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed Moralis swaps for {}", skipped, tokenAddress);
        }
        collected.sort(Comparator.comparingDouble(Transaction::timestamp));
        List<Transaction> result = collected.size() > limit ? List.copyOf(collected.subList(0, limit)) : List.copyOf(collected);
        log.info("Fetched {} buys from Moralis for {} in {} pages", result.size(), tokenAddress, pages);
        return result;
    }

    String swapsUrl(String tokenAddress, long fromTime, int pageSize, String cursor) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getMoralis().getBaseUrl())
                .pathSegment("token", "mainnet", tokenAddress, "swaps")
                .queryParam("order", "ASC")
                .queryParam("transactionTypes", "buy")
                .queryParam("fromDate", fromTime)
                .queryParam("limit", pageSize);
        if (cursor != null) {
            builder.queryParam("cursor", cursor);
        }
        return builder.encode().toUriString();
    }

    private Map<String, String> headers() {
        return Map.of("X-API-Key", properties.getMoralis().getApiKey());
    }

    /**
     * Parses one swaps response: {@code {"cursor": "...", "result": [...]}}.
     */
    public static SwapPage parseSwapPage(JsonNode root) {
        JsonNode result = root == null ? null : root.get("result");
        if (result == null || !result.isArray()) {
            return new SwapPage(List.of(), 0, 0, null);
        }
        List<Transaction> transactions = new ArrayList<>();
        int skipped = 0;
        for (JsonNode swap : result) {
            Optional<Transaction> tx = TransactionNormalizer.fromMoralisSwap(swap);
            if (tx.isPresent() && tx.get().isBuy()) {
                transactions.add(tx.get());
            } else {
                skipped++;
            }
        }
        JsonNode cursorNode = root.get("cursor");
        String cursor = cursorNode == null || cursorNode.isNull() || cursorNode.asText().isBlank()
                ? null : cursorNode.asText();
        return new SwapPage(List.copyOf(transactions), result.size(), skipped, cursor);
    }

    /**
     * @param records number of raw records in the page, valid or not
     */
    public record SwapPage(List<Transaction> transactions, int records, int skipped, String cursor) {
    }
}
