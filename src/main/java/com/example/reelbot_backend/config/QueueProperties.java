package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry budget and retention windows of the in-memory job queue.
 */
@ConfigurationProperties(prefix = "queue")
public class QueueProperties {
    private int defaultMaxRetries = 3;
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Duration completedRetention = Duration.ofHours(1);
    private Duration failedRetention = Duration.ofHours(24);

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public Duration getCompletedRetention() {
        return completedRetention;
    }

    public void setCompletedRetention(Duration completedRetention) {
        this.completedRetention = completedRetention;
    }

    public Duration getFailedRetention() {
        return failedRetention;
    }

    public void setFailedRetention(Duration failedRetention) {
        this.failedRetention = failedRetention;
    }
}
