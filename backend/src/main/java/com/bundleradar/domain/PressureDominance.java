package com.bundleradar.domain;

public enum PressureDominance {
    STRONG_BUY,
    BUY,
    NEUTRAL,
    SELL,
    STRONG_SELL
}
