package com.example.reelbot_backend.engine.Interfaces;

import com.example.reelbot_backend.service.queue.VideoResult;
import com.example.reelbot_backend.util.ProviderState;

import java.util.List;

/**
 * Remote generation capability. Calls block for at most the configured provider timeout and
 * report failures as {@link com.example.reelbot_backend.engine.ProviderException}.
 */
public interface GenerationProvider {

    /** Model family a handle belongs to; the provider scopes handles per model. */
    enum Target { VIDEO, CLIP, STITCH }

    record GenerationRequest(Target target,
                             String prompt,
                             String imageUrl,
                             String voiceId,
                             String aspectRatio,
                             Integer durationSeconds) {}

    record StitchRequest(List<String> videoUrls, String aspectRatio) {}

    record ProviderStatus(ProviderState state, Integer queuePosition, String error) {}

    String submit(GenerationRequest request);

    ProviderStatus status(Target target, String handle);

    VideoResult result(Target target, String handle);

    String submitStitch(StitchRequest request);
}
