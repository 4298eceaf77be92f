package com.bundleradar.domain;

import java.util.Locale;

/**
 * Swap direction relative to the analyzed token.
 */
public enum TxType {
    BUY,
    SELL;

    /**
     * Maps upstream side strings ("buy", "SELL", ...) to a type; null for anything else.
     */
    public static TxType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> null;
        };
    }
}
