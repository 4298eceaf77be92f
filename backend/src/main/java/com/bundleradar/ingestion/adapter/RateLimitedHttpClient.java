package com.bundleradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking GET through a provider-wide local rate limiter with a fixed per-request timeout.
 * One instance per upstream provider so that every adapter of that provider shares the budget.
 */
@Slf4j
public class RateLimitedHttpClient {

    private static final long LIMITER_LOG_THRESHOLD_MS = 500;

    private final String providerName;
    private final ProviderHttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public RateLimitedHttpClient(String providerName, ProviderHttpClient httpClient, RateLimiter rateLimiter,
                                 Duration timeout, ObjectMapper objectMapper) {
        this.providerName = providerName;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    /**
     * GET and parse the body as JSON. An empty body yields a missing node.
     */
    public JsonNode getJson(String url, Map<String, String> headers) {
        String body = get(url, headers);
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unparseable " + providerName + " response from " + url, e);
        }
    }

    public String get(String url, Map<String, String> headers) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new ProviderException("Local limiter timeout before " + providerName + " call " + url);
        }
        if (waitedMs >= LIMITER_LOG_THRESHOLD_MS) {
            log.info("Local {} limiter delayed {} ms before {}", providerName, waitedMs, url);
        }
        try {
            return httpClient.get(url, headers).block(timeout);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(providerName + " call failed for " + url + ": " + e.getMessage(), e);
        }
    }

    public String getProviderName() {
        return providerName;
    }
}
