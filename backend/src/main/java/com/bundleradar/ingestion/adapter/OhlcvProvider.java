package com.bundleradar.ingestion.adapter;

import com.bundleradar.domain.Candle;

import java.util.List;

/**
 * Price candles for a token.
 */
public interface OhlcvProvider {

    /**
     * @param granularity candle size in upstream notation, e.g. "1D", "15m"
     * @return candles in the range; empty when none are available
     */
    List<Candle> fetch(String tokenAddress, long timeFrom, long timeTo, String granularity);
}
