package com.bundleradar.ingestion.config;

import com.bundleradar.ingestion.adapter.ProviderHttpClient;
import com.bundleradar.ingestion.adapter.RateLimitedHttpClient;
import com.bundleradar.ingestion.adapter.WebClientProviderHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP client and per-provider local rate limiters. Each provider gets one limiter shared by all of its adapters.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {

    public static final String MORALIS_CLIENT = "moralisHttpClient";
    public static final String BIRDEYE_CLIENT = "birdeyeHttpClient";

    /** Upstream responses (holder lists, tx pages) can exceed the 256 KB WebClient default. */
    private static final int MAX_IN_MEMORY_BYTES = 8 * 1024 * 1024;

    @Bean
    public ProviderHttpClient providerHttpClient(WebClient.Builder webClientBuilder) {
        return new WebClientProviderHttpClient(webClientBuilder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES)));
    }

    @Bean(name = "moralisRateLimiter")
    public RateLimiter moralisRateLimiter(ProviderProperties properties) {
        return perMinute("moralis", properties.getMoralis().getRequestsPerMinute(), properties.getLimiterTimeoutMs());
    }

    @Bean(name = "birdeyeRateLimiter")
    public RateLimiter birdeyeRateLimiter(ProviderProperties properties) {
        return perMinute("birdeye", properties.getBirdeye().getRequestsPerMinute(), properties.getLimiterTimeoutMs());
    }

    @Bean(name = MORALIS_CLIENT)
    public RateLimitedHttpClient moralisHttpClient(ProviderHttpClient httpClient,
                                                   @Qualifier("moralisRateLimiter") RateLimiter limiter,
                                                   ProviderProperties properties, ObjectMapper objectMapper) {
        return new RateLimitedHttpClient("moralis", httpClient, limiter,
                Duration.ofSeconds(properties.getTimeoutSeconds()), objectMapper);
    }

    @Bean(name = BIRDEYE_CLIENT)
    public RateLimitedHttpClient birdeyeHttpClient(ProviderHttpClient httpClient,
                                                   @Qualifier("birdeyeRateLimiter") RateLimiter limiter,
                                                   ProviderProperties properties, ObjectMapper objectMapper) {
        return new RateLimitedHttpClient("birdeye", httpClient, limiter,
                Duration.ofSeconds(properties.getTimeoutSeconds()), objectMapper);
    }

    /** One permit per {@code 60s / requestsPerMinute}: 300 rpm spaces calls 200 ms apart instead of allowing a burst. */
    static RateLimiter perMinute(String name, int requestsPerMinute, long timeoutMs) {
        long periodMs = Math.max(1L, 60_000L / Math.max(1, requestsPerMinute));
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(periodMs))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, timeoutMs)))
                .build();
        return RateLimiter.of(name, config);
    }
}
