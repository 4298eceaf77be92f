package com.bundleradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for provider lookups. Creation info is immutable and kept for a day;
 * holder stats and candles follow {@code bundleradar.provider.cache-ttl-minutes}.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CREATION_INFO_CACHE = "creationInfoCache";
    public static final String HOLDER_STATS_CACHE = "holderStatsCache";
    public static final String OHLCV_CACHE = "ohlcvCache";

    @Bean
    public CacheManager caffeineCacheManager(@Value("${bundleradar.provider.cache-ttl-minutes:10}") long ttlMinutes) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CREATION_INFO_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        manager.registerCustomCache(HOLDER_STATS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(OHLCV_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        return manager;
    }
}
