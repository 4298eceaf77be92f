package com.bundleradar.ingestion.adapter.birdeye;

import com.bundleradar.config.AsyncConfig;
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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Earliest buys from BirdEye {@code /defi/v3/token/txs}. Offset pages are requested concurrently, at most
 * {@code maxConcurrentPages} in flight, each also passing the shared BirdEye rate limiter. Pages are merged in
 * offset order up to the first short page, then re-sorted by timestamp.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bundleradar.analysis.feed", havingValue = "BIRDEYE")
public class BirdeyeTransactionFeed implements TransactionFeed {

    private final RateLimitedHttpClient httpClient;
    private final ProviderProperties properties;
    private final Executor pageExecutor;

    public BirdeyeTransactionFeed(@Qualifier(ProviderConfig.BIRDEYE_CLIENT) RateLimitedHttpClient httpClient,
                                  ProviderProperties properties,
                                  @Qualifier(AsyncConfig.PROVIDER_PAGE_EXECUTOR) Executor pageExecutor) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.pageExecutor = pageExecutor;
    }

    @Override
    public List<Transaction> fetch(String tokenAddress, long fromTime, int limit) {
        ProviderProperties.Birdeye birdeye = properties.getBirdeye();
        if (limit <= 0) {
            return List.of();
        }
        if (!BirdeyeHeaders.hasApiKey(properties)) {
            log.warn("BirdEye API key not configured; no transactions fetched for {}", tokenAddress);
            return List.of();
        }
        int pageSize = birdeye.getPageSize();
        int pageCount = Math.min(birdeye.getMaxPages(), (limit + pageSize - 1) / pageSize);
        Semaphore inFlight = new Semaphore(Math.max(1, birdeye.getMaxConcurrentPages()));

        List<CompletableFuture<TxPage>> futures = new ArrayList<>(pageCount);
        for (int page = 0; page < pageCount; page++) {
            String url = txsUrl(tokenAddress, fromTime, page * pageSize, pageSize);
            futures.add(CompletableFuture.supplyAsync(() -> fetchPage(url, inFlight), pageExecutor));
        }

        List<Transaction> collected = new ArrayList<>();
        int skipped = 0;
        for (int page = 0; page < futures.size(); page++) {
            TxPage result;
            try {
                result = futures.get(page).join();
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException re ? re : e;
                if (page == 0) {
                    throw cause instanceof ProviderException pe ? pe
                            : new ProviderException("BirdEye txs failed for " + tokenAddress, cause);
                }
                log.warn("BirdEye txs page {} failed for {}; keeping {} transactions", page, tokenAddress,
                        collected.size(), cause);
                break;
            }
            collected.addAll(result.transactions());
            skipped += result.skipped();
            if (result.records() < pageSize) {
                break;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed or non-buy BirdEye txs for {}", skipped, tokenAddress);
        }
        collected.sort(Comparator.comparingDouble(Transaction::timestamp));
        List<Transaction> result = collected.size() > limit ? List.copyOf(collected.subList(0, limit)) : List.copyOf(collected);
        log.info("Fetched {} buys from BirdEye for {} ({} pages requested)", result.size(), tokenAddress, pageCount);
        return result;
    }

    private TxPage fetchPage(String url, Semaphore inFlight) {
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted waiting for BirdEye page slot", e);
        }
        try {
            return parseTxPage(httpClient.getJson(url, BirdeyeHeaders.of(properties, "solana")));
        } finally {
            inFlight.release();
        }
    }

    String txsUrl(String tokenAddress, long fromTime, int offset, int pageSize) {
        return UriComponentsBuilder.fromHttpUrl(properties.getBirdeye().getBaseUrl())
                .path("/defi/v3/token/txs")
                .queryParam("address", tokenAddress)
                .queryParam("offset", offset)
                .queryParam("limit", pageSize)
                .queryParam("sort_by", "block_unix_time")
                .queryParam("sort_type", "asc")
                .queryParam("tx_type", "buy")
                .queryParam("after_time", fromTime)
                .queryParam("ui_amount_mode", "scaled")
                .encode().toUriString();
    }

    /**
     * Parses {@code {"data": {"items": [...]}}}; sells and malformed items count as skipped.
     */
    public static TxPage parseTxPage(JsonNode root) {
        JsonNode items = root == null ? null : root.path("data").get("items");
        if (items == null || !items.isArray()) {
            return new TxPage(List.of(), 0, 0);
        }
        List<Transaction> transactions = new ArrayList<>();
        int skipped = 0;
        for (JsonNode item : items) {
            Optional<Transaction> tx = TransactionNormalizer.fromBirdeyeTx(item);
            if (tx.isPresent() && tx.get().isBuy()) {
                transactions.add(tx.get());
            } else {
                skipped++;
            }
        }
        return new TxPage(List.copyOf(transactions), items.size(), skipped);
    }

    public record TxPage(List<Transaction> transactions, int records, int skipped) {
    }
}
