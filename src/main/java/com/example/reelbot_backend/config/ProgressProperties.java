package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the progress stream. The band thresholds are heuristics, not measured values.
 */
@ConfigurationProperties(prefix = "progress")
public class ProgressProperties {
    private Duration tick = Duration.ofMillis(500);
    private int syncEvery = 3;
    private Duration maxSession = Duration.ofMinutes(5);
    private int defaultEstimateSeconds = 30;
    private int maxEstimateSeconds = 300;
    private Bands bands = new Bands();

    public Duration getTick() {
        return tick;
    }

    public void setTick(Duration tick) {
        this.tick = tick;
    }

    public int getSyncEvery() {
        return syncEvery;
    }

    public void setSyncEvery(int syncEvery) {
        this.syncEvery = syncEvery;
    }

    public Duration getMaxSession() {
        return maxSession;
    }

    public void setMaxSession(Duration maxSession) {
        this.maxSession = maxSession;
    }

    public int getDefaultEstimateSeconds() {
        return defaultEstimateSeconds;
    }

    public void setDefaultEstimateSeconds(int defaultEstimateSeconds) {
        this.defaultEstimateSeconds = defaultEstimateSeconds;
    }

    public int getMaxEstimateSeconds() {
        return maxEstimateSeconds;
    }

    public void setMaxEstimateSeconds(int maxEstimateSeconds) {
        this.maxEstimateSeconds = maxEstimateSeconds;
    }

    public Bands getBands() {
        return bands;
    }

    public void setBands(Bands bands) {
        this.bands = bands;
    }

    /**
     * Lower bounds (inclusive) of the audio, video and processing stages; script starts at 0.
     */
    public static class Bands {
        private int audio = 25;
        private int video = 50;
        private int processing = 85;

        public int getAudio() {
            return audio;
        }

        public void setAudio(int audio) {
            this.audio = audio;
        }

        public int getVideo() {
            return video;
        }

        public void setVideo(int video) {
            this.video = video;
        }

        public int getProcessing() {
            return processing;
        }

        public void setProcessing(int processing) {
            this.processing = processing;
        }
    }
}
