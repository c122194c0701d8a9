package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configures the background dispatcher: executor sizing, provider submission concurrency and the
 * backoff applied before a re-queued job is submitted again.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private int executorThreads = 4;
    private int executorQueueCapacity = 50;
    private int maxConcurrentSubmissions = 2;
    private Duration pollInterval = Duration.ofSeconds(3);
    private Duration retryInitialDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(30);

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getMaxConcurrentSubmissions() {
        return maxConcurrentSubmissions;
    }

    public void setMaxConcurrentSubmissions(int maxConcurrentSubmissions) {
        this.maxConcurrentSubmissions = maxConcurrentSubmissions;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getRetryInitialDelay() {
        return retryInitialDelay;
    }

    public void setRetryInitialDelay(Duration retryInitialDelay) {
        this.retryInitialDelay = retryInitialDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    /**
     * Exponential backoff before re-submitting a job that has failed {@code retryCount} times.
     *
     * @param retryCount number of failures recorded on the job.
     * @return delay to wait after the job's last update.
     */
    public Duration backoffFor(int retryCount) {
        int exponent = Math.max(0, Math.min(retryCount - 1, 16));
        long millis = retryInitialDelay.toMillis() * (1L << exponent);
        return Duration.ofMillis(Math.min(millis, retryMaxDelay.toMillis()));
    }
}
