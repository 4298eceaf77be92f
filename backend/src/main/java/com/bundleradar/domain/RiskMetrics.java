package com.bundleradar.domain;

/**
 * Aggregate bundle risk metrics.
 *
 * @param bundleIntensityScore        0..100, cluster frequency, size and density
 * @param walletConcentrationRisk     0..1, share of bundled wallets reused across clusters
 * @param bundleTimingConsistency     0..1, regular spacing between clusters scores higher
 * @param earlyTradingDominance       0..100, percent of the earliest transactions inside a cluster window
 * @param coordinationSophistication  overall coordination level
 */
public record RiskMetrics(
        double bundleIntensityScore,
        double walletConcentrationRisk,
        double bundleTimingConsistency,
        double earlyTradingDominance,
        CoordinationLevel coordinationSophistication
) {

    public static RiskMetrics none() {
        return new RiskMetrics(0.0, 0.0, 0.0, 0.0, CoordinationLevel.LOW);
    }
}
