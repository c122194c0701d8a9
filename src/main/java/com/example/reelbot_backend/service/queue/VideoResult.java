package com.example.reelbot_backend.service.queue;

/**
 * Final artifact of a generation. Dimensions are optional because not every provider reports them.
 */
public record VideoResult(String url, Double durationSeconds, String contentType, Integer width, Integer height) {

    public static VideoResult ofUrl(String url, Double durationSeconds) {
        return new VideoResult(url, durationSeconds, "video/mp4", null, null);
    }
}
