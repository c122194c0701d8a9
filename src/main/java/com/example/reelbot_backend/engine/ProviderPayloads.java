package com.example.reelbot_backend.engine;

import com.example.reelbot_backend.service.queue.VideoResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Readers for provider JSON shared by the polling client and the webhook path.
 */
public final class ProviderPayloads {

    private ProviderPayloads() {}

    /**
     * Extracts the video artifact from a provider result ({@code video.url}, or a flat {@code video_url}).
     */
    public static Optional<VideoResult> parseVideo(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Optional.empty();
        }
        JsonNode video = root.path("video");
        String url = text(video, "url");
        if (url == null) url = text(root, "video_url");
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Double duration = video.hasNonNull("duration") ? Double.valueOf(video.get("duration").asDouble())
                : root.hasNonNull("duration") ? Double.valueOf(root.get("duration").asDouble()) : null;
        String contentType = Optional.ofNullable(text(video, "content_type")).orElse("video/mp4");
        Integer width = video.hasNonNull("width") ? Integer.valueOf(video.get("width").asInt()) : null;
        Integer height = video.hasNonNull("height") ? Integer.valueOf(video.get("height").asInt()) : null;
        return Optional.of(new VideoResult(url, duration, contentType, width, height));
    }

    public static Optional<String> thumbnailUrl(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(text(root.path("thumbnail"), "url"));
    }

    static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
