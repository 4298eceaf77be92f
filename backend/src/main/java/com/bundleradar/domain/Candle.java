package com.bundleradar.domain;

/**
 * OHLCV candle in USD.
 */
public record Candle(long unixTime, double open, double high, double low, double close, double volumeUsd) {
}
