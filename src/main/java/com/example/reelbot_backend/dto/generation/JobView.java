package com.example.reelbot_backend.dto.generation;

import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.service.queue.VideoResult;

import java.time.Instant;

/**
 * Listing view of a queued job; metadata is left out because it carries the review text.
 */
public record JobView(String id,
                      String ownerId,
                      String reviewId,
                      String status,
                      String priority,
                      int progress,
                      VideoResult result,
                      String error,
                      int retryCount,
                      int maxRetries,
                      Instant createdAt,
                      Instant updatedAt,
                      Instant startedAt,
                      Instant completedAt) {

    public static JobView of(VideoJob job) {
        return new JobView(job.id(), job.ownerId(), job.correlationId(), job.status().name().toLowerCase(),
                job.priority().name().toLowerCase(), job.progress(), job.result(), job.error(), job.retryCount(),
                job.maxRetries(), job.createdAt(), job.updatedAt(), job.startedAt(), job.completedAt());
    }
}
