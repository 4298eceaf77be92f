package com.bundleradar.detection;

import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;

import java.util.List;

/**
 * Output of one detection pass.
 *
 * @param detected           true when at least one cluster was accepted
 * @param clusters           accepted clusters in anchor order
 * @param totalBundledTokens deduplicated token volume inside accepted windows
 * @param analyzed           sorted buys the clusters were computed from
 */
public record BundleDetectionResult(
        boolean detected,
        List<BundleCluster> clusters,
        double totalBundledTokens,
        List<Transaction> analyzed
) {

    public BundleDetectionResult {
        clusters = List.copyOf(clusters);
        analyzed = List.copyOf(analyzed);
    }

    public static BundleDetectionResult empty() {
        return new BundleDetectionResult(false, List.of(), 0.0, List.of());
    }
}
