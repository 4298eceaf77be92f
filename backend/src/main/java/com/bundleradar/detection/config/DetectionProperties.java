package com.bundleradar.detection.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Clustering and scoring parameters. Documented in application.yml under bundleradar.detection.
 */
@ConfigurationProperties(prefix = "bundleradar.detection")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DetectionProperties {

    /** Window length anchored at each transaction. Default 2.0s. */
    @DecimalMin("0.0")
    private double windowSeconds = 2.0;

    /** Smallest window that can become a cluster. Default 3. */
    @Min(1)
    private int minTradesInCluster = 3;

    /** Diversity ratio at or below which a cluster is accepted outright. Default 0.7. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double maxWalletDiversity = 0.7;

    /** Composite score at or above which a diverse cluster is still accepted. Default 0.5. */
    @DecimalMin("0.0")
    private double scoreThreshold = 0.5;

    /** Volume CV at which the coherence component of the score reaches zero. Default 0.2. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double volumeCvCeiling = 0.2;

    /** Creation time further than this from the earliest buy is considered unreliable. Default 1 day. */
    @Min(0)
    private long launchTimeToleranceSeconds = 86_400;

    /** Number of earliest buys fetched per run. Default 300. */
    @Min(1)
    private int maxTransactions = 300;

    /** Upper bound on sample hashes kept per cluster. Default 5. */
    @Min(1)
    private int sampleTxLimit = 5;
}
