package com.bundleradar.domain;

/**
 * How sophisticated the bundling coordination looks.
 */
public enum CoordinationLevel {
    LOW,
    MEDIUM,
    HIGH
}
