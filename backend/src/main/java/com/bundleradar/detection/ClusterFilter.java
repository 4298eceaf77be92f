package com.bundleradar.detection;

import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps clusters that look like a single actor and rolls up their token volume.
 */
@Component
@RequiredArgsConstructor
public class ClusterFilter {

    private final DetectionProperties properties;

    /**
     * A cluster is kept when its wallet diversity is low enough OR its composite score is high enough.
     */
    public boolean accepts(BundleCluster cluster) {
        return cluster.walletDiversityRatio() <= properties.getMaxWalletDiversity()
                || cluster.score() >= properties.getScoreThreshold();
    }

    public List<BundleCluster> filter(List<BundleCluster> candidates) {
        return candidates.stream().filter(this::accepts).toList();
    }

    /**
     * Sum of tokens received by transactions inside any accepted cluster window. Overlapping windows
     * share members, so each transaction index contributes at most once.
     */
    public double bundledTokenVolume(List<BundleCluster> accepted, List<Transaction> analyzed) {
        double total = 0.0;
        for (int idx : coveredIndices(accepted, analyzed)) {
            total += analyzed.get(idx).tokenAmount();
        }
        return total;
    }

    /**
     * Number of distinct transactions inside any accepted cluster window.
     */
    public int bundledTransactionCount(List<BundleCluster> accepted, List<Transaction> analyzed) {
        return coveredIndices(accepted, analyzed).size();
    }

    private static Set<Integer> coveredIndices(List<BundleCluster> accepted, List<Transaction> analyzed) {
        Set<Integer> covered = new TreeSet<>();
        for (BundleCluster cluster : accepted) {
            for (int idx = 0; idx < analyzed.size(); idx++) {
                if (!covered.contains(idx) && cluster.covers(analyzed.get(idx).timestamp())) {
                    covered.add(idx);
                }
            }
        }
        return covered;
    }
}
