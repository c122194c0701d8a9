package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.ProviderProperties;
import com.example.reelbot_backend.dto.generation.SubmitGenerationRequest;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.AspectRatio;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Creates single-stage jobs and performs provider submissions, both the first one and the
 * re-submissions driven by {@link DispatchWorker}.
 */
@Service
public class SubmissionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubmissionService.class);
    static final Set<Integer> SUPPORTED_DURATIONS = Set.of(5, 10);
    static final int DEFAULT_DURATION = 5;
    static final String ANONYMOUS_OWNER = "anonymous";

    private final JobQueue queue;
    private final GenerationProvider provider;
    private final TestimonialPromptBuilder prompts;
    private final ProviderProperties providerProps;
    private final Clock clock;

    public SubmissionService(JobQueue queue,
                             GenerationProvider provider,
                             TestimonialPromptBuilder prompts,
                             ProviderProperties providerProps,
                             Clock clock) {
        this.queue = queue;
        this.provider = provider;
        this.prompts = prompts;
        this.providerProps = providerProps;
        this.clock = clock;
    }

    /**
     * Validates the request, records the job and submits it once. A failed first submission does
     * not fail the call: the job is either re-queued for the dispatcher or terminally failed, and
     * the caller sees that status.
     */
    public VideoJob submit(SubmitGenerationRequest request) {
        if (providerProps.getApiKey() == null || providerProps.getApiKey().isBlank()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_NOT_CONFIGURED");
        }
        AspectRatio ratio = request.aspectRatio() == null ? AspectRatio.PORTRAIT
                : AspectRatio.fromLabel(request.aspectRatio())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_ASPECT_RATIO"));
        int duration = request.durationSeconds() == null ? DEFAULT_DURATION : request.durationSeconds();
        if (!SUPPORTED_DURATIONS.contains(duration)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_DURATION");
        }
        JobPriority priority;
        try {
            priority = JobPriority.parseOrDefault(request.priority(), JobPriority.NORMAL);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PRIORITY");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reviewText", request.reviewText());
        metadata.put("reviewerName", request.reviewerName());
        metadata.put("businessName", request.businessName());
        metadata.put("style", request.style());
        metadata.put("aspectRatio", ratio.label());
        metadata.put("durationSeconds", duration);

        String owner = isBlank(request.ownerId()) ? ANONYMOUS_OWNER : request.ownerId();
        String review = isBlank(request.reviewId()) ? "review_" + clock.millis() : request.reviewId();
        VideoJob job = queue.create(owner, review, priority, metadata);
        attempt(job);
        return queue.get(job.id()).orElse(job);
    }

    /**
     * Submits a pending job to the provider and binds the returned handle.
     *
     * @return {@code true} when the job is now processing.
     */
    public boolean attempt(VideoJob job) {
        if (job.status() != JobStatus.PENDING) {
            return false;
        }
        GenerationProvider.GenerationRequest request = toProviderRequest(job);
        String handle;
        try {
            handle = provider.submit(request);
        } catch (ProviderException e) {
            if (e.isRetryable()) {
                queue.fail(job.id(), e.getMessage());
            } else {
                queue.failPermanently(job.id(), e.getMessage());
            }
            LOGGER.warn("JOB SUBMIT failed id={} retryable={} error={}", job.id(), e.isRetryable(), e.getMessage());
            return false;
        }
        try {
            queue.startProcessing(job.id(), handle);
        } catch (IllegalStateException e) {
            // cancelled or deleted while the submission was in flight; the provider request is orphaned
            LOGGER.warn("JOB SUBMIT orphaned id={} handle={} reason={}", job.id(), handle, e.getMessage());
            return false;
        }
        LOGGER.info("JOB SUBMIT id={} handle={} attempt={}", job.id(), handle, job.retryCount() + 1);
        return true;
    }

    private GenerationProvider.GenerationRequest toProviderRequest(VideoJob job) {
        Map<String, Object> md = job.metadata();
        String prompt = prompts.singleTake(String.valueOf(md.get("businessName")), (String) md.get("style"));
        String ratio = AspectRatio.fromLabel((String) md.get("aspectRatio")).orElse(AspectRatio.PORTRAIT).providerRatio();
        Integer duration = md.get("durationSeconds") instanceof Number n ? n.intValue() : DEFAULT_DURATION;
        return new GenerationProvider.GenerationRequest(GenerationProvider.Target.VIDEO, prompt, null, null, ratio, duration);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
