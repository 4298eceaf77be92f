package com.bundleradar.domain;

/**
 * Single-candle close-to-close drop above the large-drop threshold.
 *
 * @param day         candle index in the sorted window
 * @param dropPercent absolute drop in percent
 * @param unixTime    candle open time
 */
public record LargeDrop(int day, double dropPercent, long unixTime) {
}
