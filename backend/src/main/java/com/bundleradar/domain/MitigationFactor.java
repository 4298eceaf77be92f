package com.bundleradar.domain;

/**
 * How much a post-launch sell-off lowers forward risk for new buyers.
 */
public enum MitigationFactor {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}
