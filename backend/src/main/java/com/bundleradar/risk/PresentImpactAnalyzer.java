package com.bundleradar.risk;

import com.bundleradar.common.Statistics;
import com.bundleradar.domain.AnalysisMethod;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Chain;
import com.bundleradar.domain.HolderStats;
import com.bundleradar.domain.ImpactRiskLevel;
import com.bundleradar.domain.PresentImpactResult;
import com.bundleradar.domain.Transaction;
import com.bundleradar.ingestion.adapter.HolderStatsProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Estimates the present-day risk left by bundled wallets. The pattern score (0..100) is always computed;
 * when holder statistics are available it is combined with a holder score. Holder lookup failures fall back
 * to the pattern score and never propagate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresentImpactAnalyzer {

    static final int MINIMAL_ACTIVITY_SCORE = 5;

    private final HolderStatsProvider holderStatsProvider;

    /**
     * @return empty when no bundled wallet could be resolved from the cluster samples
     */
    public Optional<PresentImpactResult> analyze(List<BundleCluster> clusters, List<Transaction> transactions,
                                                 String tokenAddress, Chain chain) {
        ClusterWallets wallets = ClusterWallets.of(clusters, transactions);
        if (wallets.bundledWalletCount() == 0) {
            return Optional.empty();
        }
        PatternScore pattern = patternScore(clusters, wallets);
        ImpactRiskLevel patternLevel = patternLevel(pattern.score());
        double initialTokens = Statistics.round(wallets.initialTokensBought(), 2);

        try {
            Optional<HolderStats> holders = holderStatsProvider.fetch(chain, tokenAddress);
            if (holders.isEmpty()) {
                return Optional.of(PresentImpactResult.builder()
                        .bundledWalletsCount(wallets.bundledWalletCount())
                        .totalInitialTokensBought(initialTokens)
                        .patternRiskScore(pattern.score())
                        .patternRiskFactors(pattern.factors())
                        .currentImpactRisk(patternLevel)
                        .analysisMethod(AnalysisMethod.PATTERN_ONLY)
                        .dataLimitation("Holder data unavailable")
                        .analysisNote(String.format(Locale.ROOT,
                                "Pattern-based risk: %s (score %d/100) from %d bundle clusters and %d unique bundled wallets",
                                patternLevel, pattern.score(), clusters.size(), wallets.bundledWalletCount()))
                        .build());
            }
            return Optional.of(combined(holders.get(), pattern, wallets, initialTokens));
        } catch (RuntimeException e) {
            log.warn("Holder data unavailable for {} on {}, using pattern score only: {}", tokenAddress, chain, e.getMessage());
            return Optional.of(PresentImpactResult.builder()
                    .bundledWalletsCount(wallets.bundledWalletCount())
                    .totalInitialTokensBought(initialTokens)
                    .patternRiskScore(pattern.score())
                    .patternRiskFactors(pattern.factors())
                    .currentImpactRisk(patternLevel)
                    .analysisMethod(AnalysisMethod.PATTERN_ONLY_FALLBACK)
                    .errorNote("Holder data fetch failed: " + e.getMessage())
                    .analysisNote(String.format(Locale.ROOT,
                            "Pattern-based risk: %s (score %d/100); fallback after holder data failure",
                            patternLevel, pattern.score()))
                    .build());
        }
    }

    private PresentImpactResult combined(HolderStats holders, PatternScore pattern, ClusterWallets wallets,
                                         double initialTokens) {
        long totalHolders = holders.totalHolders();
        double penetration = totalHolders > 0 ? (double) wallets.bundledWalletCount() / totalHolders * 100.0 : 0.0;
        double top10 = holders.top10ConcentrationPct() != null ? holders.top10ConcentrationPct() : 0.0;
        Double change24h = holders.holderChange24hPct();

        int holderScore = 0;
        List<String> holderFactors = new ArrayList<>();
        if (penetration > 15) {
            holderScore += 30;
            holderFactors.add(String.format(Locale.ROOT, "High bundled wallet presence (%.1f%%)", penetration));
        } else if (penetration > 10) {
            holderScore += 20;
            holderFactors.add(String.format(Locale.ROOT, "Significant bundled wallet presence (%.1f%%)", penetration));
        }
        if (top10 > 50) {
            holderScore += 20;
            holderFactors.add(String.format(Locale.ROOT, "Very high top-10 concentration (%.1f%%)", top10));
        }
        if (change24h != null && change24h < -10) {
            holderScore += 20;
            holderFactors.add("Significant holder exodus (>10% decrease)");
        }

        int combinedScore = Math.min(100, pattern.score() + holderScore);
        ImpactRiskLevel level = combinedLevel(combinedScore);
        return PresentImpactResult.builder()
                .bundledWalletsCount(wallets.bundledWalletCount())
                .totalInitialTokensBought(initialTokens)
                .totalCurrentHolders(totalHolders)
                .bundledWalletPenetrationPct(Statistics.round(penetration, 2))
                .top10ConcentrationPct(top10)
                .holderChange24hPct(change24h)
                .patternRiskScore(pattern.score())
                .patternRiskFactors(pattern.factors())
                .holderRiskScore(holderScore)
                .holderRiskFactors(List.copyOf(holderFactors))
                .combinedRiskScore(combinedScore)
                .currentImpactRisk(level)
                .analysisMethod(AnalysisMethod.PATTERN_AND_HOLDER_DATA)
                .analysisNote(String.format(Locale.ROOT, "Combined risk: %s (pattern %d, holder %d)",
                        level, pattern.score(), holderScore))
                .build();
    }

    PatternScore patternScore(List<BundleCluster> clusters, ClusterWallets wallets) {
        int clusterCount = clusters.size();
        int bundledTxs = clusters.stream().mapToInt(BundleCluster::clusterSize).sum();
        List<String> factors = new ArrayList<>();

        if (clusterCount <= 3 && bundledTxs <= 15) {
            factors.add(String.format(Locale.ROOT, "Minimal bundle activity (%d clusters, %d transactions)",
                    clusterCount, bundledTxs));
            return new PatternScore(MINIMAL_ACTIVITY_SCORE, List.copyOf(factors));
        }

        int score = 0;
        score += clusterVolumePoints(clusterCount, factors);

        int reused = wallets.reusedWalletCount();
        int bundledWallets = wallets.bundledWalletCount();
        if (reused > bundledWallets * 0.5) {
            score += 30;
            factors.add("High wallet reuse across bundles (>50%)");
        } else if (reused > bundledWallets * 0.3) {
            score += 20;
            factors.add("Significant wallet reuse across bundles (>30%)");
        } else if (reused > 0) {
            score += 10;
            factors.add("Some wallet reuse detected");
        }

        long large = clusters.stream().filter(c -> c.clusterSize() > 15).count();
        long veryLarge = clusters.stream().filter(c -> c.clusterSize() > 25).count();
        if (veryLarge > 0) {
            score += 20;
            factors.add(String.format(Locale.ROOT, "Very large bundle clusters detected (%d clusters >25 txs)", veryLarge));
        } else if (large > clusterCount * 0.4) {
            score += 15;
            factors.add("Many large bundle clusters (>15 transactions)");
        } else if (large > clusterCount * 0.2) {
            score += 10;
            factors.add("Some large bundle clusters detected");
        } else if (large > 0) {
            score += 5;
            factors.add("Few large bundle clusters");
        }

        if (clusterCount > 5) {
            List<Double> gaps = RiskMetricsEngine.gapsBetween(clusters);
            if (!gaps.isEmpty()) {
                double avgGap = Statistics.mean(gaps);
                if (avgGap < 10) {
                    score += 10;
                    factors.add("Rapid-fire bundle execution (<10s average)");
                } else if (avgGap < 30) {
                    score += 5;
                    factors.add("Quick bundle succession (<30s average)");
                }
            }
        }
        return new PatternScore(score, List.copyOf(factors));
    }

    private static int clusterVolumePoints(int clusterCount, List<String> factors) {
        if (clusterCount > 100) {
            factors.add(String.format(Locale.ROOT, "Extreme bundle activity (%d clusters)", clusterCount));
            return 40;
        }
        if (clusterCount > 50) {
            factors.add(String.format(Locale.ROOT, "Very high bundle activity (%d clusters)", clusterCount));
            return 30;
        }
        if (clusterCount > 25) {
            factors.add(String.format(Locale.ROOT, "High bundle activity (%d clusters)", clusterCount));
            return 20;
        }
        if (clusterCount > 10) {
            factors.add(String.format(Locale.ROOT, "Moderate bundle activity (%d clusters)", clusterCount));
            return 15;
        }
        if (clusterCount > 5) {
            factors.add(String.format(Locale.ROOT, "Some bundle activity (%d clusters)", clusterCount));
            return 10;
        }
        if (clusterCount > 3) {
            factors.add(String.format(Locale.ROOT, "Low bundle activity (%d clusters)", clusterCount));
            return 5;
        }
        return 0;
    }

    static ImpactRiskLevel patternLevel(int score) {
        if (score >= 80) {
            return ImpactRiskLevel.CRITICAL;
        }
        if (score >= 60) {
            return ImpactRiskLevel.HIGH;
        }
        if (score >= 35) {
            return ImpactRiskLevel.MEDIUM;
        }
        return ImpactRiskLevel.LOW;
    }

    /** Same as {@link #patternLevel(int)} except MEDIUM starts at 40. */
    static ImpactRiskLevel combinedLevel(int score) {
        if (score >= 80) {
            return ImpactRiskLevel.CRITICAL;
        }
        if (score >= 60) {
            return ImpactRiskLevel.HIGH;
        }
        if (score >= 40) {
            return ImpactRiskLevel.MEDIUM;
        }
        return ImpactRiskLevel.LOW;
    }

    record PatternScore(int score, List<String> factors) {
    }
}
