package com.bundleradar.detection;

import com.bundleradar.common.Statistics;
import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a candidate window into a {@link BundleCluster} with diversity, coherence and a composite score in [0,1]:
 * <pre>
 * 0.5 * max(0, 1 - (size / minTrades - 1))
 * + 0.3 * max(0, 1 - diversity / maxDiversity)
 * + 0.2 * max(0, 1 - volumeCv / volumeCvCeiling)
 * </pre>
 * Small windows, few wallets and near-identical trade sizes all push the score up.
 */
@Component
@RequiredArgsConstructor
public class ClusterScorer {

    private final DetectionProperties properties;

    public BundleCluster score(TransactionWindow window) {
        List<Transaction> txs = window.transactions();
        int size = txs.size();

        Set<String> wallets = new HashSet<>();
        for (Transaction tx : txs) {
            wallets.add(tx.wallet());
        }
        int uniqueWallets = wallets.size();
        double diversity = size > 0 ? (double) uniqueWallets / size : 1.0;

        List<Double> volumes = new ArrayList<>();
        for (Transaction tx : txs) {
            if (tx.volumeUsd() > 0) {
                volumes.add(tx.volumeUsd());
            }
        }
        double volumeCv = Statistics.coefficientOfVariation(volumes);

        double score = compositeScore(size, diversity, volumeCv);

        List<String> samples = new ArrayList<>();
        for (Transaction tx : txs) {
            if (samples.size() >= properties.getSampleTxLimit()) {
                break;
            }
            if (tx.txHash() != null && !tx.txHash().isBlank()) {
                samples.add(tx.txHash());
            }
        }

        return new BundleCluster(
                size,
                properties.getWindowSeconds(),
                uniqueWallets,
                Statistics.round(diversity, 3),
                Statistics.round(score, 3),
                samples,
                Math.floor(window.anchorTime()));
    }

    double compositeScore(int size, double diversity, double volumeCv) {
        double minTrades = properties.getMinTradesInCluster();
        double sizeComponent = Math.max(0.0, 1.0 - (size / minTrades - 1.0));
        double diversityComponent = Math.max(0.0, 1.0 - diversity / properties.getMaxWalletDiversity());
        double coherenceComponent = Math.max(0.0, 1.0 - volumeCv / properties.getVolumeCvCeiling());
        return 0.5 * sizeComponent + 0.3 * diversityComponent + 0.2 * coherenceComponent;
    }
}
