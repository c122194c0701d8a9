package com.example.reelbot_backend.service.queue;

import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable snapshot of a single-stage generation job. Every queue mutation produces a new instance.
 * Metadata entries with a null key or value are dropped. {@code sequence} is the submission order
 * within the queue.
 */
public record VideoJob(
        String id,
        String ownerId,
        String correlationId,
        JobStatus status,
        JobPriority priority,
        int progress,
        String providerHandle,
        VideoResult result,
        String error,
        int retryCount,
        int maxRetries,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        Map<String, Object> metadata,
        long sequence
) {
    public VideoJob {
        metadata = metadata == null ? Map.of() : copyWithoutNulls(metadata);
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> metadata) {
        Map<String, Object> copy = new HashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    Builder toBuilder() {
        return new Builder(this);
    }

    static final class Builder {
        private final VideoJob base;
        private JobStatus status;
        private JobPriority priority;
        private int progress;
        private String providerHandle;
        private VideoResult result;
        private String error;
        private int retryCount;
        private Instant startedAt;
        private Instant completedAt;

        private Builder(VideoJob base) {
            this.base = base;
            this.status = base.status;
            this.priority = base.priority;
            this.progress = base.progress;
            this.providerHandle = base.providerHandle;
            this.result = base.result;
            this.error = base.error;
            this.retryCount = base.retryCount;
            this.startedAt = base.startedAt;
            this.completedAt = base.completedAt;
        }

        Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        Builder providerHandle(String providerHandle) {
            this.providerHandle = providerHandle;
            return this;
        }

        Builder result(VideoResult result) {
            this.result = result;
            return this;
        }

        Builder error(String error) {
            this.error = error;
            return this;
        }

        Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        VideoJob build(Instant updatedAt) {
            return new VideoJob(base.id, base.ownerId, base.correlationId, status, priority, progress,
                    providerHandle, result, error, retryCount, base.maxRetries, base.createdAt, updatedAt,
                    startedAt, completedAt, base.metadata, base.sequence);
        }
    }
}
