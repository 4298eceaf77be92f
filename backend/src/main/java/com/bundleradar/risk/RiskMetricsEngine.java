package com.bundleradar.risk;

import com.bundleradar.common.Statistics;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.CoordinationLevel;
import com.bundleradar.domain.RiskMetrics;
import com.bundleradar.domain.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates accepted clusters into intensity, wallet concentration, timing consistency and
 * early-trading dominance, then grades the coordination level.
 */
@Component
public class RiskMetricsEngine {

    static final int EARLY_WINDOW = 300;

    public RiskMetrics calculate(List<BundleCluster> clusters, List<Transaction> transactions, int transactionsAnalyzed) {
        if (clusters == null || clusters.isEmpty() || transactions == null || transactions.isEmpty()) {
            return RiskMetrics.none();
        }

        double intensity = intensityScore(clusters, transactionsAnalyzed);
        double concentration = concentrationRisk(clusters, transactions);
        double timing = timingConsistency(clusters);
        double dominance = earlyTradingDominance(clusters, transactions);

        return new RiskMetrics(
                Statistics.round(intensity, 1),
                Statistics.round(concentration, 3),
                Statistics.round(timing, 3),
                Statistics.round(dominance, 1),
                sophistication(intensity, concentration));
    }

    double intensityScore(List<BundleCluster> clusters, int transactionsAnalyzed) {
        int n = Math.max(transactionsAnalyzed, 1);
        int bundledTxs = clusters.stream().mapToInt(BundleCluster::clusterSize).sum();
        double frequency = (double) clusters.size() / n;
        double avgClusterSize = (double) bundledTxs / clusters.size();
        double density = (double) bundledTxs / n;
        return Statistics.clamp(frequency * 200 + (avgClusterSize - 3) * 10 + density * 150, 0, 100);
    }

    double concentrationRisk(List<BundleCluster> clusters, List<Transaction> transactions) {
        ClusterWallets wallets = ClusterWallets.of(clusters, transactions);
        if (wallets.bundledWalletCount() == 0) {
            return 0.0;
        }
        return Statistics.clamp((double) wallets.reusedWalletCount() / wallets.bundledWalletCount(), 0, 1);
    }

    /**
     * Regular spacing between clusters reads as scripted execution: 1 - min(1, cv(gaps) / 2).
     */
    double timingConsistency(List<BundleCluster> clusters) {
        List<Double> gaps = gapsBetween(clusters);
        if (gaps.isEmpty()) {
            return 0.0;
        }
        double cv = Statistics.coefficientOfVariation(gaps);
        return Math.max(0.0, 1.0 - Math.min(1.0, cv / 2.0));
    }

    /**
     * Percent of the first {@value #EARLY_WINDOW} transactions that fall inside any cluster window.
     */
    double earlyTradingDominance(List<BundleCluster> clusters, List<Transaction> transactions) {
        int window = Math.min(EARLY_WINDOW, transactions.size());
        if (window == 0) {
            return 0.0;
        }
        Set<Integer> bundled = new HashSet<>();
        for (int i = 0; i < window; i++) {
            double ts = transactions.get(i).timestamp();
            for (BundleCluster cluster : clusters) {
                if (cluster.covers(ts)) {
                    bundled.add(i);
                    break;
                }
            }
        }
        return (double) bundled.size() / window * 100.0;
    }

    static CoordinationLevel sophistication(double intensity, double concentration) {
        if (intensity > 60 && concentration > 0.5) {
            return CoordinationLevel.HIGH;
        }
        if (intensity > 30 || concentration > 0.3) {
            return CoordinationLevel.MEDIUM;
        }
        return CoordinationLevel.LOW;
    }

    static List<Double> gapsBetween(List<BundleCluster> clusters) {
        List<BundleCluster> sorted = clusters.stream()
                .sorted(Comparator.comparingDouble(BundleCluster::firstUnix))
                .toList();
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            gaps.add(sorted.get(i).firstUnix() - sorted.get(i - 1).firstUnix());
        }
        return gaps;
    }
}
