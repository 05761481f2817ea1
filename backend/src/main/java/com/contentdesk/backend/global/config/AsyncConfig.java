package com.contentdesk.backend.global.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work that must not block the request thread on its own:
 * audit writes and bulk ownership lookups.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String AUDIT_EXECUTOR = "auditExecutor";
    public static final String OWNERSHIP_EXECUTOR = "ownershipLookupExecutor";

    @Bean(name = AUDIT_EXECUTOR)
    public Executor auditExecutor(
            @Value("${contentdesk.audit.pool-size:2}") int poolSize,
            @Value("${contentdesk.audit.queue-capacity:1000}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("audit-");
        executor.initialize();
        return executor;
    }

    @Bean(name = OWNERSHIP_EXECUTOR)
    public Executor ownershipLookupExecutor(
            @Value("${contentdesk.ownership.max-concurrency:8}") int maxConcurrency
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrency);
        executor.setMaxPoolSize(maxConcurrency);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("ownership-");
        executor.initialize();
        return executor;
    }
}
