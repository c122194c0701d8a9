package com.example.reelbot_backend.dto.composite;

import jakarta.validation.constraints.NotBlank;

public record CompositeStartRequest(
        @NotBlank(message = "OWNER_ID_REQUIRED") String ownerId,
        @NotBlank(message = "REVIEW_ID_REQUIRED") String reviewId,
        @NotBlank(message = "ACTOR_ID_REQUIRED") String actorId,
        String script,
        Integer targetDuration,
        String aspectRatio,
        String voiceId
) {}
