package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the remote generation provider and its webhook channel.
 */
@ConfigurationProperties(prefix = "provider")
public class ProviderProperties {
    private String baseUrl = "https://queue.fal.run";
    private String apiKey;
    private String model = "fal-ai/kling-video/v2.5-turbo/pro/text-to-video";
    private String clipModel = "fal-ai/veo3/fast/image-to-video";
    private String stitchModel = "fal-ai/ffmpeg-api/merge-videos";
    private long timeoutSeconds = 15;
    private Webhook webhook = new Webhook();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getClipModel() {
        return clipModel;
    }

    public void setClipModel(String clipModel) {
        this.clipModel = clipModel;
    }

    public String getStitchModel() {
        return stitchModel;
    }

    public void setStitchModel(String stitchModel) {
        this.stitchModel = stitchModel;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    public static class Webhook {
        private String secret;
        private String callbackUrl;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getCallbackUrl() {
            return callbackUrl;
        }

        public void setCallbackUrl(String callbackUrl) {
            this.callbackUrl = callbackUrl;
        }
    }
}
