package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Post-launch sell-off assessment from daily candles.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PriceActionResult {

    boolean selloffDetected;
    SelloffSeverity selloffSeverity;
    Double priceDeclineFromPeakPct;
    Double peakPrice;
    Double currentPrice;
    int largeDropsCount;
    @Builder.Default
    List<LargeDrop> largeDrops = List.of();
    int highVolumeSelloffs;
    Double avgDailyVolatilityPct;
    Double maxDailyVolatilityPct;
    @Builder.Default
    MitigationFactor riskMitigationFactor = MitigationFactor.NONE;
    @Builder.Default
    List<String> riskFactors = List.of();
    int dataPoints;
    String analysisNote;

    /**
     * Result for windows that cannot be judged (too few candles, no valid prices).
     */
    public static PriceActionResult unknown(int dataPoints, String note) {
        return PriceActionResult.builder()
                .selloffDetected(false)
                .selloffSeverity(SelloffSeverity.UNKNOWN)
                .dataPoints(dataPoints)
                .analysisNote(note)
                .build();
    }
}
