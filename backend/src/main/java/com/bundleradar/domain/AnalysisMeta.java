package com.bundleradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Run metadata attached to every report. {@code error} is set only on degraded reports;
 * {@code notes} carries per-feature diagnostics (e.g. a timed out price-action lookup).
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisMeta {

    int transactionsAnalyzed;
    Instant analysisTime;
    String source;
    Integer firstNTransactions;
    Integer ohlcvWindowDays;
    double bundledTransactionPercentage;
    String error;
    @Builder.Default
    List<String> notes = List.of();
}
