package com.bundleradar.risk;

import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wallets behind each cluster, resolved from the cluster's sample transaction hashes.
 * Samples whose hash is not in the transaction list are ignored.
 */
final class ClusterWallets {

    private final Set<String> bundledWallets = new LinkedHashSet<>();
    private final Map<String, Integer> clustersPerWallet = new HashMap<>();
    private final double initialTokensBought;

    private ClusterWallets(List<BundleCluster> clusters, List<Transaction> transactions) {
        Map<String, Transaction> byHash = new HashMap<>();
        for (Transaction tx : transactions) {
            byHash.putIfAbsent(tx.txHash(), tx);
        }
        double tokens = 0.0;
        for (BundleCluster cluster : clusters) {
            Set<String> walletsInCluster = new LinkedHashSet<>();
            for (String hash : cluster.sampleTxHashes()) {
                Transaction tx = byHash.get(hash);
                if (tx == null || tx.wallet() == null || tx.wallet().isBlank()) {
                    continue;
                }
                walletsInCluster.add(tx.wallet());
                tokens += tx.tokenAmount();
            }
            bundledWallets.addAll(walletsInCluster);
            for (String wallet : walletsInCluster) {
                clustersPerWallet.merge(wallet, 1, Integer::sum);
            }
        }
        this.initialTokensBought = tokens;
    }

    static ClusterWallets of(List<BundleCluster> clusters, List<Transaction> transactions) {
        return new ClusterWallets(clusters, transactions);
    }

    int bundledWalletCount() {
        return bundledWallets.size();
    }

    /** Wallets that show up in more than one cluster. */
    int reusedWalletCount() {
        return (int) clustersPerWallet.values().stream().filter(c -> c > 1).count();
    }

    /** Tokens received by the sampled bundle transactions. */
    double initialTokensBought() {
        return initialTokensBought;
    }
}
