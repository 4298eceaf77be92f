package com.bundleradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: analysis-executor runs the post-detection risk tasks, provider-page-executor
 * fetches transaction pages in parallel.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String PROVIDER_PAGE_EXECUTOR = "provider-page-executor";

    /** Two tasks per analysis (present impact, price action); sized for a few concurrent analyses. */
    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(64);
        e.setThreadNamePrefix("analysis-");
        e.initialize();
        return e;
    }

    @Bean(name = PROVIDER_PAGE_EXECUTOR)
    public Executor providerPageExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("provider-page-");
        e.initialize();
        return e;
    }
}
