package com.example.reelbot_backend.dto.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider notification. {@code payload} carries the generation output on success; {@code error}
 * the provider's message on failure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderWebhookPayload(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") String status,
        @JsonProperty("queue_position") Integer queuePosition,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("error") String error
) {}
