package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actor catalog keyed by actor id.
 */
@ConfigurationProperties(prefix = "actors")
public class ActorProperties {
    private Map<String, Actor> catalog = new LinkedHashMap<>();

    public Map<String, Actor> getCatalog() {
        return catalog;
    }

    public void setCatalog(Map<String, Actor> catalog) {
        this.catalog = catalog;
    }

    public static class Actor {
        private String name;
        private String referenceImageUrl;
        private String voiceId;
        private String voicePrompt;
        private boolean active = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getReferenceImageUrl() {
            return referenceImageUrl;
        }

        public void setReferenceImageUrl(String referenceImageUrl) {
            this.referenceImageUrl = referenceImageUrl;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getVoicePrompt() {
            return voicePrompt;
        }

        public void setVoicePrompt(String voicePrompt) {
            this.voicePrompt = voicePrompt;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }
}
