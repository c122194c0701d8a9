package com.example.reelbot_backend.dto.progress;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time progress of a job or composite as shown to clients. Composite-only fields stay null
 * for single-stage jobs and are omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressSnapshot(
        String id,
        String stage,
        int stageProgress,
        int overallProgress,
        int estimatedTimeRemaining,
        String status,
        String videoUrl,
        String thumbnailUrl,
        String error,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        String priority,
        Integer retryCount,
        Integer currentClip,
        Integer totalClips,
        List<ClipProgress> clips
) {
    public boolean isTerminal() {
        return "complete".equals(status) || "error".equals(status);
    }

    public static ProgressSnapshot error(String id, String message, Instant now) {
        return new ProgressSnapshot(id, "error", 0, 0, 0, "error", null, null, message, null, now,
                null, null, null, null, null, null, null);
    }
}
