package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.DispatchProperties;
import com.example.reelbot_backend.config.PipelineProperties;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.repository.CompositeClipRepository;
import com.example.reelbot_backend.repository.CompositeVideoRepository;
import com.example.reelbot_backend.service.Interfaces.ActorDirectory;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.ClipStatus;
import com.example.reelbot_backend.util.CompositeStatus;
import com.example.reelbot_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Background loop that keeps work moving when no request or webhook does: re-submits re-queued
 * jobs, submits composite clips one at a time per composite, polls in-flight work and restarts
 * stitch submissions that never got a handle.
 */
@Service
public class DispatchWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchWorker.class);

    private final JobQueue queue;
    private final SubmissionService submissions;
    private final StatusReconciler statusReconciler;
    private final CompositeReconciler compositeReconciler;
    private final StitchDispatcher stitchDispatcher;
    private final CompositeVideoRepository compositeRepo;
    private final CompositeClipRepository clipRepo;
    private final GenerationProvider provider;
    private final ActorDirectory actors;
    private final TestimonialPromptBuilder prompts;
    private final TaskExecutor executor;
    private final DispatchProperties props;
    private final PipelineProperties pipeline;
    private final Clock clock;
    private final Semaphore submitSemaphore;
    private final Set<String> jobsInFlight = ConcurrentHashMap.newKeySet();
    private final Set<UUID> compositesInFlight = ConcurrentHashMap.newKeySet();

    public DispatchWorker(JobQueue queue,
                          SubmissionService submissions,
                          StatusReconciler statusReconciler,
                          CompositeReconciler compositeReconciler,
                          StitchDispatcher stitchDispatcher,
                          CompositeVideoRepository compositeRepo,
                          CompositeClipRepository clipRepo,
                          GenerationProvider provider,
                          ActorDirectory actors,
                          TestimonialPromptBuilder prompts,
                          @Qualifier("dispatchTaskExecutor") TaskExecutor executor,
                          DispatchProperties props,
                          PipelineProperties pipeline,
                          Clock clock) {
        this.queue = queue;
        this.submissions = submissions;
        this.statusReconciler = statusReconciler;
        this.compositeReconciler = compositeReconciler;
        this.stitchDispatcher = stitchDispatcher;
        this.compositeRepo = compositeRepo;
        this.clipRepo = clipRepo;
        this.provider = provider;
        this.actors = actors;
        this.prompts = prompts;
        this.executor = executor;
        this.props = props;
        this.pipeline = pipeline;
        this.clock = clock;
        this.submitSemaphore = new Semaphore(Math.max(1, props.getMaxConcurrentSubmissions()));
    }

    @Scheduled(fixedDelayString = "${dispatch.poll-interval:PT3S}")
    public void tick() {
        try {
            resubmitPendingJobs();
            dispatchClips();
            pollInFlight();
            restartStitches();
        } catch (RuntimeException e) {
            LOGGER.error("DISPATCH tick failed: {}", e.toString(), e);
        }
    }

    /**
     * Re-submits jobs that went back to PENDING after a failure, in queue order, once their backoff
     * has elapsed. Fresh jobs (no failure yet) belong to the request that created them.
     */
    void resubmitPendingJobs() {
        Instant now = clock.instant();
        for (VideoJob job : queue.listPending()) {
            if (job.retryCount() == 0 || now.isBefore(job.updatedAt().plus(props.backoffFor(job.retryCount())))) {
                continue;
            }
            if (!jobsInFlight.add(job.id())) {
                continue;
            }
            runBounded(() -> {
                try {
                    queue.get(job.id()).ifPresent(submissions::attempt);
                } finally {
                    jobsInFlight.remove(job.id());
                }
            }, () -> jobsInFlight.remove(job.id()));
        }
    }

    void dispatchClips() {
        for (CompositeVideo composite : compositeRepo.findByStatus(CompositeStatus.GENERATING_CLIPS)) {
            if (compositesInFlight.contains(composite.getId())) {
                continue;
            }
            List<CompositeClip> clips = clipRepo.findByCompositeIdOrderByClipIndexAsc(composite.getId());
            boolean busy = clips.stream().anyMatch(c -> ClipStatus.IN_FLIGHT.contains(c.getStatus()));
            if (busy) {
                continue;
            }
            clips.stream()
                    .filter(c -> c.getStatus() == ClipStatus.PENDING)
                    .findFirst()
                    .ifPresent(next -> claimAndSubmit(composite, next));
        }
    }

    void pollInFlight() {
        for (VideoJob job : queue.listByStatus(JobStatus.PROCESSING)) {
            statusReconciler.pollJob(job.id());
        }
        for (CompositeClip clip : clipRepo.findByStatusInAndProviderHandleIsNotNull(ClipStatus.IN_FLIGHT)) {
            compositeReconciler.pollClip(clip);
        }
        for (CompositeVideo composite : compositeRepo.findByStatus(CompositeStatus.STITCHING)) {
            if (composite.getStitchHandle() != null) {
                compositeReconciler.pollStitch(composite);
            }
        }
    }

    void restartStitches() {
        for (CompositeVideo composite : compositeRepo.findByStatusAndStitchHandleIsNull(CompositeStatus.STITCHING)) {
            if (stitchDispatcher.dispatchAsync(composite.getId())) {
                LOGGER.info("STITCH restart composite={}", composite.getId());
            }
        }
    }

    private void claimAndSubmit(CompositeVideo composite, CompositeClip clip) {
        if (!compositesInFlight.add(composite.getId())) {
            return;
        }
        if (clipRepo.claimForDispatch(clip.getId(), clock.instant()) != 1) {
            compositesInFlight.remove(composite.getId());
            return;
        }
        runBounded(() -> {
            try {
                submitClip(composite, clip);
            } finally {
                compositesInFlight.remove(composite.getId());
            }
        }, () -> {
            compositesInFlight.remove(composite.getId());
            clipRepo.requeue(clip.getId(), "Dispatch queue full", clock.instant());
        });
    }

    void submitClip(CompositeVideo composite, CompositeClip clip) {
        int attempt = clip.getAttempts() + 1;
        String imageUrl = actors.findActive(composite.getActorId())
                .map(ActorDirectory.Actor::referenceImageUrl)
                .orElse(null);
        var request = new GenerationProvider.GenerationRequest(
                GenerationProvider.Target.CLIP,
                prompts.clip(clip.getClipType(), clip.getScriptContent()),
                imageUrl,
                composite.getVoiceId(),
                composite.getAspectRatio().providerRatio(),
                null);
        try {
            String handle = provider.submit(request);
            clipRepo.bindHandle(clip.getId(), handle, clock.instant());
            LOGGER.info("CLIP SUBMIT composite={} clip={} handle={} attempt={}", composite.getId(), clip.getClipIndex(), handle, attempt);
        } catch (ProviderException e) {
            if (e.isRetryable() && attempt < pipeline.getMaxClipAttempts()) {
                clipRepo.requeue(clip.getId(), e.getMessage(), clock.instant());
                LOGGER.warn("CLIP SUBMIT deferred composite={} clip={} attempt={} error={}", composite.getId(),
                        clip.getClipIndex(), attempt, e.getMessage());
            } else {
                clipRepo.markFailed(clip.getId(), e.getMessage(), clock.instant());
                LOGGER.error("CLIP SUBMIT failed composite={} clip={} attempt={} error={}", composite.getId(),
                        clip.getClipIndex(), attempt, e.getMessage());
            }
        }
    }

    private void runBounded(Runnable work, Runnable onRejected) {
        try {
            executor.execute(() -> {
                boolean acquired = false;
                try {
                    submitSemaphore.acquire();
                    acquired = true;
                    work.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("DISPATCH interrupted before running");
                    onRejected.run();
                } catch (RuntimeException e) {
                    LOGGER.error("DISPATCH task failed: {}", e.toString(), e);
                } finally {
                    if (acquired) {
                        submitSemaphore.release();
                    }
                }
            });
        } catch (RuntimeException e) {
            LOGGER.warn("DISPATCH rejected: {}", e.toString());
            onRejected.run();
        }
    }
}
