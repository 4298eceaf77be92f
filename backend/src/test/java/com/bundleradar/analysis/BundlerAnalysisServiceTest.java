package com.bundleradar.analysis;

import com.bundleradar.analysis.config.AnalysisProperties;
import com.bundleradar.detection.BundleDetector;
import com.bundleradar.detection.ClusterFilter;
import com.bundleradar.detection.ClusterScorer;
import com.bundleradar.detection.WindowClusterer;
import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.AnalysisMethod;
import com.bundleradar.domain.BundlerAnalysisReport;
import com.bundleradar.domain.Candle;
import com.bundleradar.domain.Chain;
import com.bundleradar.domain.CoordinationLevel;
import com.bundleradar.domain.CreationInfo;
import com.bundleradar.domain.RiskMetrics;
import com.bundleradar.domain.Transaction;
import com.bundleradar.domain.TxType;
import com.bundleradar.ingestion.adapter.CreationInfoProvider;
import com.bundleradar.ingestion.adapter.HolderStatsProvider;
import com.bundleradar.ingestion.adapter.OhlcvProvider;
import com.bundleradar.ingestion.adapter.ProviderException;
import com.bundleradar.ingestion.adapter.TransactionFeed;
import com.bundleradar.risk.PresentImpactAnalyzer;
import com.bundleradar.risk.PriceActionAnalyzer;
import com.bundleradar.risk.RiskMetricsEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BundlerAnalysisServiceTest {

    private static final String TOKEN = "So1anaMint1111111111111111111111111111111";
    private static final long LAUNCH = 1_700_000_000L;
    private static final CreationInfo CREATION = new CreationInfo("2023-11-14T22:13:20Z", "creationTx", LAUNCH);

    @Mock
    CreationInfoProvider creationInfoProvider;
    @Mock
    TransactionFeed transactionFeed;
    @Mock
    OhlcvProvider ohlcvProvider;
    @Mock
    HolderStatsProvider holderStatsProvider;

    private ExecutorService executor;
    private AnalysisProperties analysisProperties;
    private BundlerAnalysisService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        analysisProperties = new AnalysisProperties();
        service = newService(executor);
    }

    private BundlerAnalysisService newService(Executor analysisExecutor) {
        DetectionProperties detection = new DetectionProperties();
        return new BundlerAnalysisService(
                creationInfoProvider,
                transactionFeed,
                ohlcvProvider,
                new BundleDetector(detection, new WindowClusterer(detection), new ClusterScorer(detection),
                        new ClusterFilter(detection)),
                new ClusterFilter(detection),
                new RiskMetricsEngine(),
                new PresentImpactAnalyzer(holderStatsProvider),
                new PriceActionAnalyzer(),
                detection,
                analysisProperties,
                analysisExecutor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Transaction buy(String hash, String wallet, double ts) {
        return new Transaction(hash, wallet, ts, TxType.BUY, 1_000.0, 25.0);
    }

    /** 4-transaction / 2-wallet burst in the first second, then one organic buy every 10s. */
    private static List<Transaction> launchWithBurst() {
        List<Transaction> txs = new ArrayList<>();
        txs.add(buy("b0", "BUNDLER_A", LAUNCH));
        txs.add(buy("b1", "BUNDLER_B", LAUNCH + 0.33));
        txs.add(buy("b2", "BUNDLER_A", LAUNCH + 0.66));
        txs.add(buy("b3", "BUNDLER_B", LAUNCH + 1.0));
        for (int i = 1; txs.size() < 300; i++) {
            txs.add(buy("o" + i, "organic" + i, LAUNCH + i * 10.0));
        }
        return txs;
    }

    private static List<Candle> candles() {
        return List.of(
                new Candle(LAUNCH, 1.0, 4.0, 0.9, 3.5, 1_000),
                new Candle(LAUNCH + 86_400, 3.5, 3.6, 1.0, 1.2, 5_000),
                new Candle(LAUNCH + 172_800, 1.2, 1.3, 0.9, 1.0, 800));
    }

    @Test
    @DisplayName("end-to-end: one injected burst among organic trades is the only bundle")
    void endToEndBurst() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(Chain.SOLANA, TOKEN)).thenReturn(Optional.empty());
        when(ohlcvProvider.fetch(TOKEN, LAUNCH, LAUNCH + 3 * 86_400L, "1D")).thenReturn(candles());

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isTrue();
        // overlapping windows: the burst is reported as b0..b3 and b1..b3
        assertThat(report.getBundleClusters()).hasSize(2)
                .allSatisfy(c -> {
                    assertThat(c.firstUnix()).isEqualTo((double) LAUNCH);
                    assertThat(c.sampleTxHashes()).isSubsetOf("b0", "b1", "b2", "b3");
                });
        assertThat(report.getBundleClusters().get(0).sampleTxHashes()).containsExactly("b0", "b1", "b2", "b3");
        assertThat(report.getBundleClusters().get(1).sampleTxHashes()).containsExactly("b1", "b2", "b3");
        assertThat(report.getBundleClusterCount()).isEqualTo(report.getBundleClusters().size());
        assertThat(report.getTotalBundledTokens()).isEqualTo(4_000.0);
        assertThat(report.getMeta().getBundledTransactionPercentage()).isEqualTo(1.3);
        assertThat(report.getMeta().getTransactionsAnalyzed()).isEqualTo(300);
        assertThat(report.getMeta().getFirstNTransactions()).isEqualTo(300);
        assertThat(report.getMeta().getOhlcvWindowDays()).isEqualTo(3);
        assertThat(report.getMeta().getError()).isNull();
        assertThat(report.getMeta().getNotes()).isEmpty();

        RiskMetrics metrics = report.getRiskMetrics();
        assertThat(metrics.earlyTradingDominance()).isGreaterThan(0);
        assertThat(metrics.coordinationSophistication()).isIn(CoordinationLevel.LOW, CoordinationLevel.MEDIUM);

        assertThat(report.getPresentImpact().getPatternRiskScore()).isEqualTo(5);
        assertThat(report.getPresentImpact().getAnalysisMethod()).isEqualTo(AnalysisMethod.PATTERN_ONLY);
        assertThat(report.getPriceAction().isSelloffDetected()).isTrue();
        assertThat(report.getCreationInfo()).isEqualTo(CREATION);
    }

    @Test
    @DisplayName("missing creation info degrades without touching the feed")
    void missingAnchor() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.empty());

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isFalse();
        assertThat(report.getBundleClusters()).isEmpty();
        assertThat(report.getCreationInfo()).isNull();
        assertThat(report.getMeta().getError()).isEqualTo(BundlerAnalysisService.CREATION_INFO_UNAVAILABLE);
        verifyNoInteractions(transactionFeed);
    }

    @Test
    @DisplayName("creation info lookup failure is treated as a missing anchor")
    void creationInfoFailure() {
        when(creationInfoProvider.fetch(TOKEN)).thenThrow(new ProviderException("401 from birdeye"));

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.getMeta().getError()).isEqualTo(BundlerAnalysisService.CREATION_INFO_UNAVAILABLE);
    }

    @Test
    @DisplayName("empty feed degrades and keeps creation info")
    void emptyFeed() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(anyString(), anyLong(), anyInt())).thenReturn(List.of());

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isFalse();
        assertThat(report.getCreationInfo()).isEqualTo(CREATION);
        assertThat(report.getMeta().getError()).isEqualTo(BundlerAnalysisService.NO_TRANSACTION_HISTORY);
        assertThat(report.getRiskMetrics()).isNull();
    }

    @Test
    @DisplayName("feed failure degrades like an empty feed")
    void feedFailure() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(anyString(), anyLong(), anyInt())).thenThrow(new ProviderException("timeout"));

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.getMeta().getError()).isEqualTo(BundlerAnalysisService.NO_TRANSACTION_HISTORY);
    }

    @Test
    @DisplayName("holder failure only downgrades present impact to the pattern fallback")
    void holderFailure() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(any(), anyString())).thenThrow(new ProviderException("503"));
        when(ohlcvProvider.fetch(anyString(), anyLong(), anyLong(), anyString())).thenReturn(candles());

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isTrue();
        assertThat(report.getPresentImpact().getAnalysisMethod()).isEqualTo(AnalysisMethod.PATTERN_ONLY_FALLBACK);
        assertThat(report.getPriceAction()).isNotNull();
        assertThat(report.getMeta().getError()).isNull();
    }

    @Test
    @DisplayName("price action timeout leaves the field absent and adds a note")
    void priceActionTimeout() {
        analysisProperties.setTaskTimeoutSeconds(1);
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(Chain.SOLANA, TOKEN)).thenReturn(Optional.empty());
        when(ohlcvProvider.fetch(anyString(), anyLong(), anyLong(), anyString())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return candles();
        });

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isTrue();
        assertThat(report.getPriceAction()).isNull();
        assertThat(report.getPresentImpact()).isNotNull();
        assertThat(report.getMeta().getNotes()).hasSize(1);
        assertThat(report.getMeta().getNotes().get(0)).contains("timed out");
    }

    @Test
    @DisplayName("each task's timeout runs from submission, so a slow holder lookup does not extend price action's budget")
    void independentTaskTimeouts() {
        analysisProperties.setTaskTimeoutSeconds(2);
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(Chain.SOLANA, TOKEN)).thenAnswer(inv -> {
            Thread.sleep(1_500);
            return Optional.empty();
        });
        when(ohlcvProvider.fetch(anyString(), anyLong(), anyLong(), anyString())).thenAnswer(inv -> {
            Thread.sleep(3_000);
            return candles();
        });

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.getPresentImpact()).isNotNull();
        assertThat(report.getPriceAction()).isNull();
        assertThat(report.getMeta().getNotes()).containsExactly("Price action analysis timed out after 2s");
    }

    @Test
    @DisplayName("a saturated executor keeps the detection result and notes both skipped tasks")
    void executorRejection() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("queue full");
        };
        BundlerAnalysisService saturated = newService(rejecting);
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());

        BundlerAnalysisReport report = saturated.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isTrue();
        assertThat(report.getRiskMetrics()).isNotNull();
        assertThat(report.getPresentImpact()).isNull();
        assertThat(report.getPriceAction()).isNull();
        assertThat(report.getMeta().getError()).isNull();
        assertThat(report.getMeta().getNotes()).containsExactly(
                "Present impact analysis skipped: analysis executor saturated",
                "Price action analysis skipped: analysis executor saturated");
        verifyNoInteractions(holderStatsProvider, ohlcvProvider);
    }

    @Test
    @DisplayName("price action failure is recorded as a note")
    void priceActionFailure() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(Chain.SOLANA, TOKEN)).thenReturn(Optional.empty());
        when(ohlcvProvider.fetch(anyString(), anyLong(), anyLong(), anyString()))
                .thenThrow(new ProviderException("429 from birdeye"));

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.getPriceAction()).isNull();
        assertThat(report.getMeta().getNotes()).hasSize(1);
        assertThat(report.getMeta().getNotes().get(0)).contains("429 from birdeye");
    }

    @Test
    @DisplayName("no OHLCV candles leaves price action absent")
    void noCandles() {
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(TOKEN, LAUNCH - 1, 300)).thenReturn(launchWithBurst());
        when(holderStatsProvider.fetch(Chain.SOLANA, TOKEN)).thenReturn(Optional.empty());
        when(ohlcvProvider.fetch(anyString(), anyLong(), anyLong(), anyString())).thenReturn(List.of());

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.getPriceAction()).isNull();
        assertThat(report.getMeta().getNotes()).isEmpty();
    }

    @Test
    @DisplayName("organic launch yields baseline metrics and skips the risk tasks")
    void organicLaunch() {
        List<Transaction> organic = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            organic.add(buy("o" + i, "w" + i, LAUNCH + i * 10.0));
        }
        when(creationInfoProvider.fetch(TOKEN)).thenReturn(Optional.of(CREATION));
        when(transactionFeed.fetch(eq(TOKEN), anyLong(), anyInt())).thenReturn(organic);

        BundlerAnalysisReport report = service.analyze(TOKEN);

        assertThat(report.isBundledDetected()).isFalse();
        assertThat(report.getRiskMetrics()).isEqualTo(RiskMetrics.none());
        assertThat(report.getMeta().getBundledTransactionPercentage()).isZero();
        assertThat(report.getPresentImpact()).isNull();
        assertThat(report.getPriceAction()).isNull();
        verify(holderStatsProvider, never()).fetch(any(), anyString());
        verifyNoInteractions(ohlcvProvider);
    }

    @Test
    @DisplayName("blank token address is rejected")
    void blankToken() {
        assertThatThrownBy(() -> service.analyze(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
