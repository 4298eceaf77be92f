package com.bundleradar.domain;

/**
 * Overall 24h market health from the sentiment score: EXCELLENT from 75, GOOD from 60, FAIR from 45.
 */
public enum MarketHealthLevel {
    EXCELLENT,
    GOOD,
    FAIR,
    LOW
}
