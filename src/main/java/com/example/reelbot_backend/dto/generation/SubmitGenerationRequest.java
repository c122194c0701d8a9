package com.example.reelbot_backend.dto.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Single-stage generation request. {@code ownerId} and {@code reviewId} are optional; when absent the
 * job is attributed to an anonymous owner and a synthetic review reference.
 */
public record SubmitGenerationRequest(
        String ownerId,
        String reviewId,
        @NotBlank(message = "REVIEW_TEXT_REQUIRED") @Size(max = 5000) String reviewText,
        @NotBlank(message = "REVIEWER_NAME_REQUIRED") String reviewerName,
        @NotBlank(message = "BUSINESS_NAME_REQUIRED") String businessName,
        @NotBlank(message = "STYLE_REQUIRED") String style,
        String aspectRatio,
        Integer durationSeconds,
        String priority
) {}
