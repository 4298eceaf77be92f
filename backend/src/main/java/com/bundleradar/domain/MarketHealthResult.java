package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Recent market condition of a token from intraday candles: price change, candle buy/sell pressure,
 * volume trend and volatility folded into a 0..100 sentiment score.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MarketHealthResult {

    boolean marketHealthAvailable;
    MarketHealthLevel marketHealth;
    Integer sentimentScore;
    @Builder.Default
    List<String> sentimentFactors = List.of();
    Double priceChange24hPct;
    Double high24h;
    Double low24h;
    Double currentPrice;
    Double buyPressurePct;
    Double sellPressurePct;
    PressureDominance pressureDominance;
    Double totalVolume24hUsd;
    Double avgVolumePerPeriodUsd;
    Double volumeChangePct;
    Double avgVolatilityPct;
    int dataPoints;
    String analysisNote;

    public static MarketHealthResult unavailable(int dataPoints, String note) {
        return MarketHealthResult.builder()
                .marketHealthAvailable(false)
                .dataPoints(dataPoints)
                .analysisNote(note)
                .build();
    }
}
