package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Everything printed for one token: the bundle analysis and, when requested, the recent market health.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenAssessment(BundlerAnalysisReport bundleAnalysis, MarketHealthResult marketHealth24h) {
}
