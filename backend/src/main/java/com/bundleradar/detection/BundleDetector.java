package com.bundleradar.detection;

import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Detects bundled buys among the earliest transactions of a token: buy filter, timestamp sort,
 * window clustering, scoring and acceptance. Stateless; the same input always yields the same result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BundleDetector {

    private final DetectionProperties properties;
    private final WindowClusterer clusterer;
    private final ClusterScorer scorer;
    private final ClusterFilter filter;

    /**
     * @param transactions earliest transactions of the token, any order, buys and sells
     * @param creationTs   token creation time in unix seconds, or null when unknown
     */
    public BundleDetectionResult detectBundles(List<Transaction> transactions, Long creationTs) {
        if (transactions == null || transactions.isEmpty()) {
            return BundleDetectionResult.empty();
        }
        List<Transaction> buys = transactions.stream()
                .filter(Transaction::isBuy)
                .sorted(Comparator.comparingDouble(Transaction::timestamp))
                .toList();
        if (buys.isEmpty()) {
            return BundleDetectionResult.empty();
        }

        double launchTime = effectiveLaunchTime(buys.get(0).timestamp(), creationTs);
        log.info("Analyzing {} buys from launch reference {}", buys.size(), (long) launchTime);

        List<BundleCluster> candidates = clusterer.windows(buys).stream()
                .map(scorer::score)
                .toList();
        List<BundleCluster> accepted = filter.filter(candidates);
        double totalBundledTokens = filter.bundledTokenVolume(accepted, buys);

        log.debug("Clustering produced {} candidates, {} accepted", candidates.size(), accepted.size());
        return new BundleDetectionResult(!accepted.isEmpty(), accepted, totalBundledTokens, buys);
    }

    /**
     * Creation time when it is plausible, otherwise the earliest buy. Reference only: every fetched buy
     * is analyzed regardless of the launch time.
     */
    double effectiveLaunchTime(double earliestBuy, Long creationTs) {
        if (creationTs == null || creationTs <= 0) {
            return earliestBuy;
        }
        if (Math.abs(creationTs - earliestBuy) > properties.getLaunchTimeToleranceSeconds()) {
            log.warn("Creation time {} is more than {}s from earliest buy {}; using earliest buy as launch reference",
                    creationTs, properties.getLaunchTimeToleranceSeconds(), (long) earliestBuy);
            return earliestBuy;
        }
        return creationTs;
    }
}
