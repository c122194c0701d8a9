package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private int defaultTargetDuration = 30;
    private int maxClipDuration = 10;
    private int maxClipAttempts = 3;
    private int secondsPerClipEstimate = 60;

    public int getDefaultTargetDuration() {
        return defaultTargetDuration;
    }

    public void setDefaultTargetDuration(int defaultTargetDuration) {
        this.defaultTargetDuration = defaultTargetDuration;
    }

    public int getMaxClipDuration() {
        return maxClipDuration;
    }

    public void setMaxClipDuration(int maxClipDuration) {
        this.maxClipDuration = maxClipDuration;
    }

    public int getMaxClipAttempts() {
        return maxClipAttempts;
    }

    public void setMaxClipAttempts(int maxClipAttempts) {
        this.maxClipAttempts = maxClipAttempts;
    }

    public int getSecondsPerClipEstimate() {
        return secondsPerClipEstimate;
    }

    public void setSecondsPerClipEstimate(int secondsPerClipEstimate) {
        this.secondsPerClipEstimate = secondsPerClipEstimate;
    }
}
