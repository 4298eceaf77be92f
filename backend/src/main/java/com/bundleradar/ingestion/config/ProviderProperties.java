package com.bundleradar.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream data provider endpoints, credentials and throttling. API keys normally come from
 * the MORALIS_API_KEY / BIRDEYE_API_KEY environment variables; a blank key disables that provider.
 */
@ConfigurationProperties(prefix = "bundleradar.provider")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    /** Per-request timeout for every provider call. */
    @Min(1)
    private int timeoutSeconds = 30;

    /** TTL of the creation-info, holder-stats and OHLCV caches. */
    @Min(0)
    private int cacheTtlMinutes = 10;

    /** How long a caller may wait for a local rate-limiter permit before the call fails. */
    @Min(0)
    private long limiterTimeoutMs = 10_000;

    @Valid
    private Moralis moralis = new Moralis();

    @Valid
    private Birdeye birdeye = new Birdeye();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Moralis {

        /** Solana gateway; swaps and Solana holder endpoints hang off it. */
        @NotBlank
        private String baseUrl = "https://solana-gateway.moralis.io";

        /** EVM deep-index API used for ERC-20 holder statistics. */
        @NotBlank
        private String evmBaseUrl = "https://deep-index.moralis.io/api/v2.2";

        private String apiKey;

        @Min(1)
        private int requestsPerMinute = 300;

        /** Swaps page size; Moralis caps it at 25. */
        @Min(1)
        private int pageSize = 25;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Birdeye {

        @NotBlank
        private String baseUrl = "https://public-api.birdeye.so";

        private String apiKey;

        @Min(1)
        private int requestsPerMinute = 300;

        @Min(1)
        private int pageSize = 100;

        /** Upper bound on offset pages requested for one token. */
        @Min(1)
        private int maxPages = 5;

        @Min(1)
        private int maxConcurrentPages = 3;
    }
}
