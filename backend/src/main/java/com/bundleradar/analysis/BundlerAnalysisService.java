package com.bundleradar.analysis;

import com.bundleradar.analysis.config.AnalysisProperties;
import com.bundleradar.common.Statistics;
import com.bundleradar.config.AsyncConfig;
import com.bundleradar.detection.BundleDetectionResult;
import com.bundleradar.detection.BundleDetector;
import com.bundleradar.detection.ClusterFilter;
import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.AnalysisMeta;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.BundlerAnalysisReport;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.CreationInfo;
import com.bundleradar.domain.PresentImpactResult;
import com.bundleradar.domain.PriceActionResult;
import com.bundleradar.domain.RiskMetrics;
import com.bundleradar.domain.Transaction;
import com.bundleradar.ingestion.adapter.CreationInfoProvider;
import com.bundleradar.ingestion.adapter.OhlcvProvider;
import com.bundleradar.ingestion.adapter.TransactionFeed;
import com.bundleradar.risk.PresentImpactAnalyzer;
import com.bundleradar.risk.PriceActionAnalyzer;
import com.bundleradar.risk.RiskMetricsEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one bundler analysis: creation time, earliest buys, detection, then present-impact and price-action
 * in parallel. Every upstream problem ends in a well-formed report; only configuration contract violations
 * ({@link IllegalArgumentException}) escape.
 */
@Service
@Slf4j
public class BundlerAnalysisService {

    static final String CREATION_INFO_UNAVAILABLE = "Creation info unavailable";
    static final String NO_TRANSACTION_HISTORY = "No transaction history available";

    private static final long SECONDS_PER_DAY = 86_400L;

    private final CreationInfoProvider creationInfoProvider;
    private final TransactionFeed transactionFeed;
    private final OhlcvProvider ohlcvProvider;
    private final BundleDetector bundleDetector;
    private final ClusterFilter clusterFilter;
    private final RiskMetricsEngine riskMetricsEngine;
    private final PresentImpactAnalyzer presentImpactAnalyzer;
    private final PriceActionAnalyzer priceActionAnalyzer;
    private final DetectionProperties detectionProperties;
    private final AnalysisProperties analysisProperties;
    private final Executor analysisExecutor;

    public BundlerAnalysisService(CreationInfoProvider creationInfoProvider,
                                  TransactionFeed transactionFeed,
                                  OhlcvProvider ohlcvProvider,
                                  BundleDetector bundleDetector,
                                  ClusterFilter clusterFilter,
                                  RiskMetricsEngine riskMetricsEngine,
                                  PresentImpactAnalyzer presentImpactAnalyzer,
                                  PriceActionAnalyzer priceActionAnalyzer,
                                  DetectionProperties detectionProperties,
                                  AnalysisProperties analysisProperties,
                                  @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor analysisExecutor) {
        this.creationInfoProvider = creationInfoProvider;
        this.transactionFeed = transactionFeed;
        this.ohlcvProvider = ohlcvProvider;
        this.bundleDetector = bundleDetector;
        this.clusterFilter = clusterFilter;
        this.riskMetricsEngine = riskMetricsEngine;
        this.presentImpactAnalyzer = presentImpactAnalyzer;
        this.priceActionAnalyzer = priceActionAnalyzer;
        this.detectionProperties = detectionProperties;
        this.analysisProperties = analysisProperties;
        this.analysisExecutor = analysisExecutor;
    }

    public BundlerAnalysisReport analyze(String tokenAddress) {
        if (tokenAddress == null || tokenAddress.isBlank()) {
            throw new IllegalArgumentException("tokenAddress must not be blank");
        }
        log.info("Starting bundler analysis for {}", tokenAddress);
        try {
            return run(tokenAddress);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Bundler analysis failed for {}", tokenAddress, e);
            return BundlerAnalysisReport.degraded(tokenAddress, null, baseMeta(0).error(e.getMessage()).build());
        }
    }

    private BundlerAnalysisReport run(String tokenAddress) {
        Optional<CreationInfo> creation = fetchCreationInfo(tokenAddress);
        if (creation.isEmpty()) {
            log.warn("Cannot analyze {}: creation info unavailable", tokenAddress);
            return BundlerAnalysisReport.degraded(tokenAddress, null,
                    baseMeta(0).error(CREATION_INFO_UNAVAILABLE).build());
        }
        CreationInfo creationInfo = creation.get();
        log.info("Token {} created at {}", tokenAddress, creationInfo.createdAt());

        List<Transaction> transactions = fetchTransactions(tokenAddress, creationInfo.blockUnixTime() - 1);
        if (transactions.isEmpty()) {
            log.warn("Cannot analyze {}: no transaction history", tokenAddress);
            return BundlerAnalysisReport.degraded(tokenAddress, creationInfo,
                    baseMeta(0).error(NO_TRANSACTION_HISTORY).build());
        }

        BundleDetectionResult detection = bundleDetector.detectBundles(transactions, creationInfo.blockUnixTime());
        List<BundleCluster> clusters = detection.clusters();
        List<String> notes = new ArrayList<>();
        PresentImpactResult presentImpact = null;
        PriceActionResult priceAction = null;
        RiskMetrics riskMetrics;

        if (detection.detected()) {
            riskMetrics = riskMetricsEngine.calculate(clusters, transactions, transactions.size());

            double firstTxTime = detection.analyzed().get(0).timestamp();
            CompletableFuture<Optional<PresentImpactResult>> impactTask = submit(
                    () -> presentImpactAnalyzer.analyze(clusters, transactions, tokenAddress, analysisProperties.getChain()));
            CompletableFuture<Optional<PriceActionResult>> priceTask = submit(
                    () -> priceAction(tokenAddress, (long) firstTxTime));

            presentImpact = await(impactTask, "Present impact analysis", tokenAddress, notes).orElse(null);
            priceAction = await(priceTask, "Price action analysis", tokenAddress, notes).orElse(null);

            log.info("Risk for {}: intensity {}/100, coordination {}, early dominance {}%, present impact {}, sell-off {}",
                    tokenAddress, riskMetrics.bundleIntensityScore(), riskMetrics.coordinationSophistication(),
                    riskMetrics.earlyTradingDominance(),
                    presentImpact != null ? presentImpact.getCurrentImpactRisk() : "n/a",
                    priceAction != null ? priceAction.getSelloffSeverity() : "n/a");
        } else {
            riskMetrics = riskMetricsEngine.calculate(List.of(), transactions, transactions.size());
            log.info("No bundles detected for {} across {} transactions", tokenAddress, transactions.size());
        }

        double bundledPct = 0.0;
        if (detection.detected()) {
            int bundledCount = clusterFilter.bundledTransactionCount(clusters, transactions);
            bundledPct = Statistics.round(100.0 * bundledCount / transactions.size(), 1);
            log.info("Bundle detected for {}: {} clusters covering {}% of transactions", tokenAddress,
                    clusters.size(), bundledPct);
        }

        AnalysisMeta meta = baseMeta(transactions.size())
                .firstNTransactions(detectionProperties.getMaxTransactions())
                .ohlcvWindowDays(analysisProperties.getOhlcvWindowDays())
                .bundledTransactionPercentage(bundledPct)
                .notes(List.copyOf(notes))
                .build();

        return BundlerAnalysisReport.builder()
                .tokenAddress(tokenAddress)
                .bundledDetected(detection.detected())
                .bundleClusterCount(clusters.size())
                .bundleClusters(clusters)
                .creationInfo(creationInfo)
                .riskMetrics(riskMetrics)
                .totalBundledTokens(Statistics.round(detection.totalBundledTokens(), 2))
                .presentImpact(presentImpact)
                .priceAction(priceAction)
                .meta(meta)
                .build();
    }

    private Optional<CreationInfo> fetchCreationInfo(String tokenAddress) {
        try {
            return creationInfoProvider.fetch(tokenAddress);
        } catch (RuntimeException e) {
            log.warn("Creation info lookup failed for {}", tokenAddress, e);
            return Optional.empty();
        }
    }

    private List<Transaction> fetchTransactions(String tokenAddress, long fromTime) {
        try {
            List<Transaction> fetched = transactionFeed.fetch(tokenAddress, fromTime, detectionProperties.getMaxTransactions());
            return fetched != null ? fetched : List.of();
        } catch (RuntimeException e) {
            log.warn("Transaction fetch failed for {}", tokenAddress, e);
            return List.of();
        }
    }

    /**
     * Candles from the first buy through the configured window; empty when no candles exist.
     */
    private Optional<PriceActionResult> priceAction(String tokenAddress, long firstTxTime) {
        long windowEnd = firstTxTime + analysisProperties.getOhlcvWindowDays() * SECONDS_PER_DAY;
        List<Candle> candles = ohlcvProvider.fetch(tokenAddress, firstTxTime, windowEnd,
                analysisProperties.getOhlcvGranularity());
        if (candles == null || candles.isEmpty()) {
            log.info("No OHLCV data for {}; price action skipped", tokenAddress);
            return Optional.empty();
        }
        return Optional.of(priceActionAnalyzer.analyze(candles));
    }

    /**
     * Starts a post-detection task with its own timeout, counted from submission.
     */
    private <T> CompletableFuture<Optional<T>> submit(Supplier<Optional<T>> work) {
        try {
            return CompletableFuture.supplyAsync(work, analysisExecutor)
                    .orTimeout(analysisProperties.getTaskTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> Optional<T> await(CompletableFuture<Optional<T>> task, String name, String tokenAddress, List<String> notes) {
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                int timeoutSeconds = analysisProperties.getTaskTimeoutSeconds();
                log.warn("{} timed out after {}s for {}", name, timeoutSeconds, tokenAddress);
                notes.add(name + " timed out after " + timeoutSeconds + "s");
            } else if (cause instanceof RejectedExecutionException) {
                log.warn("{} rejected for {}: analysis executor saturated", name, tokenAddress);
                notes.add(name + " skipped: analysis executor saturated");
            } else {
                log.warn("{} failed for {}", name, tokenAddress, cause);
                notes.add(name + " failed: " + cause.getMessage());
            }
            return Optional.empty();
        }
    }

    private AnalysisMeta.AnalysisMetaBuilder baseMeta(int transactionsAnalyzed) {
        return AnalysisMeta.builder()
                .transactionsAnalyzed(transactionsAnalyzed)
                .analysisTime(Instant.now())
                .source(analysisProperties.getFeed().getSourceDescription());
    }
}
