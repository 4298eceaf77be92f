package com.bundleradar.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Minimal HTTP GET abstraction over the provider REST APIs; returns the raw response body.
 */
public interface ProviderHttpClient {

    Mono<String> get(String url, Map<String, String> headers);
}
