package com.clapgrow.inbox.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that runs payload extraction, so a pathological payload can be
 * abandoned after {@code inbox.webhook.processing-timeout} without blocking the caller.
 */
@Configuration
public class NormalizerExecutorConfig {

    public static final String NORMALIZER_EXECUTOR = "normalizerExecutor";

    @Bean(name = NORMALIZER_EXECUTOR)
    public ThreadPoolTaskExecutor normalizerExecutor(InboxProperties properties) {
        int threads = Math.max(1, properties.getWebhook().getNormalizerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 50);
        executor.setThreadNamePrefix("normalizer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
