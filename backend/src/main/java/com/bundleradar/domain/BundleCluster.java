package com.bundleradar.domain;

import java.util.List;

/**
 * Time-windowed group of buys suspected of coordinated execution. Derived, read-only.
 * clusterSize is never below the configured minimum; walletDiversityRatio = uniqueWallets / clusterSize;
 * firstUnix is the anchor time floored to whole seconds.
 */
public record BundleCluster(
        int clusterSize,
        double windowSeconds,
        int uniqueWallets,
        double walletDiversityRatio,
        double score,
        List<String> sampleTxHashes,
        double firstUnix
) {

    public BundleCluster {
        sampleTxHashes = sampleTxHashes == null ? List.of() : List.copyOf(sampleTxHashes);
    }

    /**
     * True when the given timestamp lies in [firstUnix, firstUnix + windowSeconds].
     */
    public boolean covers(double timestamp) {
        return timestamp >= firstUnix && timestamp <= firstUnix + windowSeconds;
    }
}
