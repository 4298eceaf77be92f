package com.bundleradar.domain;

/**
 * Current holder distribution of a token. Percentages are nullable when the upstream omits them.
 */
public record HolderStats(
        long totalHolders,
        Double top10ConcentrationPct,
        Double holderChange24hPct,
        Chain chain
) {
}
