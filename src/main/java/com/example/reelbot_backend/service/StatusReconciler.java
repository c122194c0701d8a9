package com.example.reelbot_backend.service;

import com.example.reelbot_backend.dto.webhook.ProviderWebhookPayload;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.engine.ProviderPayloads;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.service.queue.VideoResult;
import com.example.reelbot_backend.util.JobStatus;
import com.example.reelbot_backend.util.ProviderState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single entry point for provider state, whether it arrives by webhook or by polling. Single-stage
 * jobs are updated here; clips and stitches are handed to {@link CompositeReconciler}.
 */
@Service
public class StatusReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusReconciler.class);
    static final String NO_VIDEO_URL = "Video generation completed but no video URL returned";
    static final String DEFAULT_FAILURE = "Video generation failed";

    public enum Outcome { JOB, CLIP, STITCH, UNMATCHED }

    private final JobQueue queue;
    private final CompositeReconciler compositeReconciler;
    private final GenerationProvider provider;

    public StatusReconciler(JobQueue queue, CompositeReconciler compositeReconciler, GenerationProvider provider) {
        this.queue = queue;
        this.compositeReconciler = compositeReconciler;
        this.provider = provider;
    }

    /**
     * Routes an authenticated notification to the record owning its handle.
     *
     * @throws com.example.reelbot_backend.util.UnknownProviderStateException for a status outside the
     *                                                                        known vocabulary.
     */
    public Outcome onWebhook(ProviderWebhookPayload payload) {
        String handle = payload.requestId();
        ProviderState state = ProviderState.fromWire(payload.status());
        Supplier<Optional<VideoResult>> result = () -> ProviderPayloads.parseVideo(payload.payload());

        Optional<VideoJob> job = queue.findByProviderHandle(handle);
        if (job.isPresent()) {
            apply(job.get(), state, payload.queuePosition(), result, payload.error());
            return Outcome.JOB;
        }
        if (compositeReconciler.onClipUpdate(handle, state, result, payload.error())) {
            return Outcome.CLIP;
        }
        String thumbnail = ProviderPayloads.thumbnailUrl(payload.payload()).orElse(null);
        if (compositeReconciler.onStitchUpdate(handle, state, result, thumbnail, payload.error())) {
            return Outcome.STITCH;
        }
        LOGGER.warn("WEBHOOK unmatched handle={} state={}", handle, state);
        return Outcome.UNMATCHED;
    }

    /**
     * Polls the provider for a processing job. Provider errors leave the job untouched.
     */
    public void pollJob(String jobId) {
        Optional<VideoJob> found = queue.get(jobId);
        if (found.isEmpty() || found.get().status() != JobStatus.PROCESSING || found.get().providerHandle() == null) {
            return;
        }
        VideoJob job = found.get();
        String handle = job.providerHandle();
        try {
            GenerationProvider.ProviderStatus status = provider.status(GenerationProvider.Target.VIDEO, handle);
            apply(job, status.state(), status.queuePosition(), () -> fetchResult(handle), status.error());
        } catch (ProviderException e) {
            LOGGER.warn("JOB POLL failed id={} handle={} retryable={} error={}", jobId, handle, e.isRetryable(), e.getMessage());
        }
    }

    void apply(VideoJob job, ProviderState state, Integer queuePosition,
               Supplier<Optional<VideoResult>> result, String error) {
        String handle = job.providerHandle();
        if (handle == null) {
            LOGGER.debug("JOB report without bound attempt id={} status={}", job.id(), job.status());
            return;
        }
        switch (state) {
            case IN_QUEUE -> queue.updateProgress(job.id(), handle, queueProgress(queuePosition));
            case IN_PROGRESS -> queue.updateProgress(job.id(), handle, 50);
            case COMPLETED -> {
                if (job.status().isTerminal()) {
                    LOGGER.debug("JOB duplicate completion id={} status={}", job.id(), job.status());
                    return;
                }
                Optional<VideoResult> video = result.get();
                if (video.isEmpty()) {
                    queue.fail(job.id(), handle, NO_VIDEO_URL);
                    return;
                }
                queue.complete(job.id(), handle, withRequestedDuration(job, video.get()))
                        .filter(done -> done.status() == JobStatus.COMPLETED)
                        .ifPresent(done -> LOGGER.info("JOB DONE id={} url={}", done.id(), video.get().url()));
            }
            case FAILED -> {
                String message = error == null || error.isBlank() ? DEFAULT_FAILURE : error;
                if (ProviderErrorClassifier.isRetryable(message)) {
                    queue.fail(job.id(), handle, message);
                } else {
                    queue.failPermanently(job.id(), handle, message);
                }
            }
        }
    }

    static int queueProgress(Integer position) {
        if (position == null) {
            return 10;
        }
        return Math.max(5, 25 - 2 * position);
    }

    private Optional<VideoResult> fetchResult(String handle) {
        try {
            return Optional.of(provider.result(GenerationProvider.Target.VIDEO, handle));
        } catch (ProviderException e) {
            if (e.isRetryable()) {
                throw e;
            }
            LOGGER.warn("RESULT unusable handle={} error={}", handle, e.getMessage());
            return Optional.empty();
        }
    }

    private static VideoResult withRequestedDuration(VideoJob job, VideoResult result) {
        Object requested = job.metadata().get("durationSeconds");
        if (requested instanceof Number n) {
            return new VideoResult(result.url(), n.doubleValue(), result.contentType(), result.width(), result.height());
        }
        return result;
    }
}
