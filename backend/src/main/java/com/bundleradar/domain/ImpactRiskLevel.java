package com.bundleradar.domain;

/**
 * Present-day risk level derived from bundled wallets.
 */
public enum ImpactRiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
