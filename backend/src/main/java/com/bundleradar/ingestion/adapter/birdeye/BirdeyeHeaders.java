package com.bundleradar.ingestion.adapter.birdeye;

import com.bundleradar.ingestion.config.ProviderProperties;

import java.util.Map;

final class BirdeyeHeaders {

    private BirdeyeHeaders() {
    }

    static Map<String, String> of(ProviderProperties properties, String chain) {
        return Map.of("X-API-KEY", properties.getBirdeye().getApiKey(), "x-chain", chain);
    }

    static boolean hasApiKey(ProviderProperties properties) {
        String key = properties.getBirdeye().getApiKey();
        return key != null && !key.isBlank();
    }
}
