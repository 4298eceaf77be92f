package com.bundleradar.domain;

/**
 * Decline from peak within the observation window. UNKNOWN when there is not enough price data.
 */
public enum SelloffSeverity {
    NONE,
    MILD,
    MODERATE,
    SEVERE,
    EXTREME,
    UNKNOWN
}
