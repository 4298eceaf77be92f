package com.bundleradar.detection;

import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.BundleCluster;
import com.bundleradar.domain.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.bundleradar.detection.DetectionFixtures.buy;
import static com.bundleradar.detection.DetectionFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BundleDetectorTest {

    private final DetectionProperties properties = DetectionFixtures.defaults();
    private final BundleDetector detector = DetectionFixtures.detector(properties);

    @Test
    @DisplayName("empty input is not detected and has no clusters or tokens")
    void emptyInput() {
        BundleDetectionResult result = detector.detectBundles(List.of(), null);

        assertThat(result.detected()).isFalse();
        assertThat(result.clusters()).isEmpty();
        assertThat(result.totalBundledTokens()).isZero();
    }

    @Test
    @DisplayName("sells are ignored")
    void sellsIgnored() {
        List<Transaction> txs = List.of(sell("a", "w1", 1), sell("b", "w1", 1.1), sell("c", "w1", 1.2));

        assertThat(detector.detectBundles(txs, null).detected()).isFalse();
    }

    @Test
    @DisplayName("4 buys from one wallet within 0.5s are a bundle")
    void singleWalletBurst() {
        List<Transaction> txs = List.of(
                buy("a", "w1", 1000.0), buy("b", "w1", 1000.1), buy("c", "w1", 1000.3), buy("d", "w1", 1000.5));

        BundleDetectionResult result = detector.detectBundles(txs, 1000L);

        assertThat(result.detected()).isTrue();
        BundleCluster first = result.clusters().get(0);
        assertThat(first.clusterSize()).isEqualTo(4);
        assertThat(first.walletDiversityRatio()).isEqualTo(0.25);
        assertThat(result.totalBundledTokens()).isEqualTo(400.0);
    }

    @Test
    @DisplayName("fractional anchor is floored and the whole burst still counts toward bundled volume")
    void fractionalAnchor() {
        List<Transaction> txs = List.of(
                buy("a", "w1", 1000.5), buy("b", "w1", 1001.0), buy("c", "w1", 1001.5));

        BundleDetectionResult result = detector.detectBundles(txs, 1000L);

        assertThat(result.detected()).isTrue();
        assertThat(result.clusters()).hasSize(1);
        assertThat(result.clusters().get(0).firstUnix()).isEqualTo(1000.0);
        assertThat(result.totalBundledTokens()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("5 distinct wallets within 1s form a size-5 window kept only on score")
    void fiveDistinctWallets() {
        List<Transaction> txs = List.of(
                buy("a", "w1", 500.0), buy("b", "w2", 500.25), buy("c", "w3", 500.5),
                buy("d", "w4", 500.75), buy("e", "w5", 501.0));
        List<TransactionWindow> windows = new WindowClusterer(properties).windows(txs);
        BundleCluster widest = new ClusterScorer(properties).score(windows.get(0));

        assertThat(widest.clusterSize()).isEqualTo(5);
        assertThat(widest.walletDiversityRatio()).isEqualTo(1.0);

        BundleDetectionResult result = detector.detectBundles(txs, null);
        boolean widestKept = result.clusters().stream().anyMatch(c -> c.clusterSize() == 5);
        assertThat(widestKept).isEqualTo(widest.score() >= properties.getScoreThreshold());
        assertThat(result.clusters()).allSatisfy(c -> assertThat(
                c.walletDiversityRatio() <= properties.getMaxWalletDiversity()
                        || c.score() >= properties.getScoreThreshold()).isTrue());
    }

    @Test
    @DisplayName("every emitted cluster honours the minimum size and diversity definition")
    void clusterInvariants() {
        List<Transaction> txs = randomLaunch(new Random(7), 300);

        BundleDetectionResult result = detector.detectBundles(txs, null);

        assertThat(result.clusters()).allSatisfy(c -> {
            assertThat(c.clusterSize()).isGreaterThanOrEqualTo(properties.getMinTradesInCluster());
            assertThat(c.walletDiversityRatio()).isGreaterThan(0).isLessThanOrEqualTo(1);
            assertThat(c.walletDiversityRatio())
                    .isCloseTo((double) c.uniqueWallets() / c.clusterSize(), within(0.0005));
        });
    }

    @Test
    @DisplayName("same input in any order yields identical clusters")
    void deterministic() {
        List<Transaction> txs = randomLaunch(new Random(11), 200);
        List<Transaction> shuffled = new ArrayList<>(txs);
        Collections.shuffle(shuffled, new Random(3));

        BundleDetectionResult first = detector.detectBundles(txs, null);
        BundleDetectionResult second = detector.detectBundles(txs, null);
        BundleDetectionResult third = detector.detectBundles(shuffled, null);

        assertThat(second.clusters()).isEqualTo(first.clusters());
        assertThat(third.clusters()).isEqualTo(first.clusters());
        assertThat(third.totalBundledTokens()).isEqualTo(first.totalBundledTokens());
    }

    @Test
    @DisplayName("implausible creation time falls back to the earliest buy")
    void launchTimeFallback() {
        assertThat(detector.effectiveLaunchTime(1_700_000_000.0, 1_600_000_000L)).isEqualTo(1_700_000_000.0);
        assertThat(detector.effectiveLaunchTime(1_700_000_000.0, 1_699_999_990L)).isEqualTo(1_699_999_990.0);
        assertThat(detector.effectiveLaunchTime(1_700_000_000.0, null)).isEqualTo(1_700_000_000.0);
    }

    /** Mostly organic trades with a few tight single-wallet bursts; timestamps are distinct. */
    private static List<Transaction> randomLaunch(Random random, int count) {
        List<Transaction> txs = new ArrayList<>();
        double t = 1_700_000_000.0;
        for (int i = 0; i < count; i++) {
            boolean burst = random.nextInt(10) == 0;
            t += burst ? 0.1 : 1 + random.nextInt(5);
            String wallet = burst ? "burst-" + (i % 3) : "w" + i;
            txs.add(buy("h" + i, wallet, t, 10 + random.nextInt(90), 5 + random.nextInt(50)));
        }
        return txs;
    }
}
