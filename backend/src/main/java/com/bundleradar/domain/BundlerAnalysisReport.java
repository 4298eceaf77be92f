package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Terminal artifact of one analysis run. Always well-formed: degraded runs carry
 * bundledDetected=false and an error in {@link AnalysisMeta}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BundlerAnalysisReport {

    String tokenAddress;
    boolean bundledDetected;
    int bundleClusterCount;
    @Builder.Default
    List<BundleCluster> bundleClusters = List.of();
    CreationInfo creationInfo;
    RiskMetrics riskMetrics;
    Double totalBundledTokens;
    PresentImpactResult presentImpact;
    PriceActionResult priceAction;
    AnalysisMeta meta;

    /**
     * Report for a run that could not get past data collection.
     */
    public static BundlerAnalysisReport degraded(String tokenAddress, CreationInfo creationInfo, AnalysisMeta meta) {
        return BundlerAnalysisReport.builder()
                .tokenAddress(tokenAddress)
                .bundledDetected(false)
                .bundleClusterCount(0)
                .creationInfo(creationInfo)
                .meta(meta)
                .build();
    }
}
