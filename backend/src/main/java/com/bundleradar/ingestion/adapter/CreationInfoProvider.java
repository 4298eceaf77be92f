package com.bundleradar.ingestion.adapter;

import com.bundleradar.domain.CreationInfo;

import java.util.Optional;

/**
 * Token creation lookup. Empty when the upstream has no record of the token.
 */
public interface CreationInfoProvider {

    Optional<CreationInfo> fetch(String tokenAddress);
}
