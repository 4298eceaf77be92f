package com.bundleradar.ingestion.adapter;

import com.bundleradar.domain.Chain;
import com.bundleradar.domain.HolderStats;

import java.util.Optional;

/**
 * Current holder distribution. Empty is not an error: some chains are simply not covered.
 */
public interface HolderStatsProvider {

    Optional<HolderStats> fetch(Chain chain, String tokenAddress);
}
