package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Present-day impact of historically bundled wallets. Holder fields are null unless
 * {@link #getAnalysisMethod()} is {@link AnalysisMethod#PATTERN_AND_HOLDER_DATA}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PresentImpactResult {

    int bundledWalletsCount;
    double totalInitialTokensBought;
    int patternRiskScore;
    @Builder.Default
    List<String> patternRiskFactors = List.of();

    Integer holderRiskScore;
    @Builder.Default
    List<String> holderRiskFactors = List.of();
    Integer combinedRiskScore;
    Long totalCurrentHolders;
    Double bundledWalletPenetrationPct;
    Double top10ConcentrationPct;
    Double holderChange24hPct;

    ImpactRiskLevel currentImpactRisk;
    AnalysisMethod analysisMethod;
    String dataLimitation;
    String errorNote;
    String analysisNote;
}
