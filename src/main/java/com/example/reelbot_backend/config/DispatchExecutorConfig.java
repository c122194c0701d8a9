package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pool used by {@link com.example.reelbot_backend.service.DispatchWorker} to
 * submit work to the provider without blocking the scheduler thread.
 */
@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchExecutorConfig {

    @Bean(name = "dispatchTaskExecutor")
    public ThreadPoolTaskExecutor dispatchTaskExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(properties.getExecutorThreads(), properties.getMaxConcurrentSubmissions());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
