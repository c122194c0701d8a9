package com.example.reelbot_backend.service.queue;

import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of single-stage generation jobs.
 *
 * <p>Mutators return {@link Optional#empty()} for unknown ids. Operations that make no sense for the
 * job's current state throw {@link IllegalStateException}; writes that arrive after the job is
 * terminal (late completions, progress updates, failures) are ignored and return the unchanged job.
 */
public interface JobQueue {

    VideoJob create(String ownerId, String correlationId, JobPriority priority, Map<String, Object> metadata);

    VideoJob create(String ownerId, String correlationId, JobPriority priority, Map<String, Object> metadata, int maxRetries);

    Optional<VideoJob> get(String id);

    /**
     * Moves a PENDING job to PROCESSING and binds the provider handle of this submission attempt.
     *
     * @throws IllegalStateException when the job is not pending, already carries a handle, or the
     *                               handle is bound to another job.
     */
    Optional<VideoJob> startProcessing(String id, String providerHandle);

    Optional<VideoJob> updateProgress(String id, int progress);

    /**
     * Like {@link #updateProgress(String, int)}, but only while the job is still bound to
     * {@code expectedHandle}. Reports about an earlier submission attempt leave the job unchanged.
     */
    Optional<VideoJob> updateProgress(String id, String expectedHandle, int progress);

    Optional<VideoJob> complete(String id, VideoResult result);

    Optional<VideoJob> complete(String id, String expectedHandle, VideoResult result);

    /**
     * Records a failure. While the retry budget lasts the job goes back to PENDING with progress 0
     * and no handle; otherwise it becomes FAILED.
     */
    Optional<VideoJob> fail(String id, String error);

    /**
     * Records a failure of the attempt bound to {@code expectedHandle}. A second report of the same
     * attempt, or a report about an attempt that was already requeued, is ignored so the retry budget
     * is charged once per attempt.
     */
    Optional<VideoJob> fail(String id, String expectedHandle, String error);

    /**
     * Records a failure that must not be retried regardless of the remaining budget.
     */
    Optional<VideoJob> failPermanently(String id, String error);

    Optional<VideoJob> failPermanently(String id, String expectedHandle, String error);

    Optional<VideoJob> cancel(String id);

    /**
     * Manual retry of a FAILED job.
     *
     * @throws IllegalStateException when the job is not failed or its retry budget is used up.
     */
    Optional<VideoJob> retry(String id);

    /**
     * @throws IllegalStateException when the job is terminal.
     */
    Optional<VideoJob> setPriority(String id, JobPriority priority);

    /**
     * Pending jobs, highest priority first, oldest first within a priority.
     */
    List<VideoJob> listPending();

    Optional<VideoJob> nextPending();

    Optional<VideoJob> findByProviderHandle(String providerHandle);

    List<VideoJob> listByOwner(String ownerId);

    List<VideoJob> listByCorrelation(String correlationId);

    List<VideoJob> listByStatus(JobStatus status);

    QueueStats stats();

    boolean delete(String id);

    /**
     * Removes terminal jobs older than their retention window.
     *
     * @return number of removed jobs.
     */
    int evictExpired();
}
