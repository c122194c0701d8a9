package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.PipelineProperties;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.repository.CompositeClipRepository;
import com.example.reelbot_backend.repository.CompositeVideoRepository;
import com.example.reelbot_backend.service.queue.VideoResult;
import com.example.reelbot_backend.util.ProviderState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies provider states to composite clips and to the stitch phase. All writes are conditional
 * updates, so duplicates and late notifications fall through as no-ops.
 */
@Service
public class CompositeReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeReconciler.class);
    static final String NO_CLIP_VIDEO = "Clip generation completed but no video URL returned";
    static final String NO_STITCH_VIDEO = "Stitching completed but no video URL returned";

    private final CompositeClipRepository clipRepo;
    private final CompositeVideoRepository compositeRepo;
    private final PipelineCoordinator coordinator;
    private final GenerationProvider provider;
    private final PipelineProperties props;
    private final Clock clock;

    public CompositeReconciler(CompositeClipRepository clipRepo,
                               CompositeVideoRepository compositeRepo,
                               PipelineCoordinator coordinator,
                               GenerationProvider provider,
                               PipelineProperties props,
                               Clock clock) {
        this.clipRepo = clipRepo;
        this.compositeRepo = compositeRepo;
        this.coordinator = coordinator;
        this.provider = provider;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @return {@code false} when no clip carries {@code handle}.
     */
    public boolean onClipUpdate(String handle, ProviderState state, Supplier<Optional<VideoResult>> result, String error) {
        Optional<CompositeClip> found = clipRepo.findByProviderHandle(handle);
        if (found.isEmpty()) {
            return false;
        }
        applyClip(found.get(), state, result, error);
        return true;
    }

    /**
     * @return {@code false} when no composite carries {@code handle} as its stitch handle.
     */
    public boolean onStitchUpdate(String handle, ProviderState state, Supplier<Optional<VideoResult>> result,
                                  String thumbnailUrl, String error) {
        Optional<CompositeVideo> found = compositeRepo.findByStitchHandle(handle);
        if (found.isEmpty()) {
            return false;
        }
        applyStitch(found.get(), state, result, thumbnailUrl, error);
        return true;
    }

    public void pollClip(CompositeClip clip) {
        if (clip.getProviderHandle() == null || clip.getStatus().isTerminal()) {
            return;
        }
        try {
            GenerationProvider.ProviderStatus status = provider.status(GenerationProvider.Target.CLIP, clip.getProviderHandle());
            applyClip(clip, status.state(), () -> fetch(GenerationProvider.Target.CLIP, clip.getProviderHandle()), status.error());
        } catch (ProviderException e) {
            LOGGER.warn("CLIP POLL failed clip={} handle={} retryable={} error={}", clip.getId(), clip.getProviderHandle(),
                    e.isRetryable(), e.getMessage());
        }
    }

    public void pollStitch(CompositeVideo composite) {
        if (composite.getStitchHandle() == null || composite.getStatus().isTerminal()) {
            return;
        }
        try {
            GenerationProvider.ProviderStatus status = provider.status(GenerationProvider.Target.STITCH, composite.getStitchHandle());
            applyStitch(composite, status.state(), () -> fetch(GenerationProvider.Target.STITCH, composite.getStitchHandle()),
                    null, status.error());
        } catch (ProviderException e) {
            LOGGER.warn("STITCH POLL failed composite={} handle={} retryable={} error={}", composite.getId(),
                    composite.getStitchHandle(), e.isRetryable(), e.getMessage());
        }
    }

    private void applyClip(CompositeClip clip, ProviderState state, Supplier<Optional<VideoResult>> result, String error) {
        switch (state) {
            case IN_QUEUE, IN_PROGRESS -> clipRepo.markGeneratingVideo(clip.getId(), clock.instant());
            case COMPLETED -> {
                if (clip.getStatus().isTerminal()) {
                    LOGGER.debug("CLIP duplicate completion clip={} status={}", clip.getId(), clip.getStatus());
                    return;
                }
                Optional<VideoResult> video = result.get();
                if (video.isEmpty()) {
                    failClip(clip, NO_CLIP_VIDEO);
                    return;
                }
                int won = clipRepo.markCompleted(clip.getId(), video.get().url(), video.get().durationSeconds(), clock.instant());
                if (won == 1) {
                    LOGGER.info("CLIP DONE composite={} clip={} url={}", clip.getCompositeId(), clip.getClipIndex(), video.get().url());
                    coordinator.onClipCompleted(clip.getCompositeId());
                }
            }
            case FAILED -> failClip(clip, error == null || error.isBlank() ? "Clip generation failed" : error);
        }
    }

    private void failClip(CompositeClip clip, String error) {
        if (ProviderErrorClassifier.isRetryable(error) && clip.getAttempts() < props.getMaxClipAttempts()) {
            if (clipRepo.requeue(clip.getId(), error, clock.instant()) == 1) {
                LOGGER.warn("CLIP REQUEUE composite={} clip={} attempt={}/{} error={}", clip.getCompositeId(),
                        clip.getClipIndex(), clip.getAttempts(), props.getMaxClipAttempts(), error);
            }
            return;
        }
        if (clipRepo.markFailed(clip.getId(), error, clock.instant()) == 1) {
            LOGGER.error("CLIP FAILED composite={} clip={} attempts={} error={}", clip.getCompositeId(),
                    clip.getClipIndex(), clip.getAttempts(), error);
        }
    }

    private void applyStitch(CompositeVideo composite, ProviderState state, Supplier<Optional<VideoResult>> result,
                             String thumbnailUrl, String error) {
        switch (state) {
            case IN_QUEUE, IN_PROGRESS -> LOGGER.debug("STITCH progress composite={} state={}", composite.getId(), state);
            case COMPLETED -> {
                if (composite.getStatus().isTerminal()) {
                    return;
                }
                Optional<VideoResult> video = result.get();
                if (video.isEmpty()) {
                    compositeRepo.markFailed(composite.getId(), NO_STITCH_VIDEO, clock.instant());
                    return;
                }
                if (compositeRepo.markCompleted(composite.getId(), video.get().url(), thumbnailUrl,
                        video.get().durationSeconds(), clock.instant()) == 1) {
                    LOGGER.info("COMPOSITE DONE id={} url={}", composite.getId(), video.get().url());
                }
            }
            case FAILED -> {
                String message = "Stitching failed: " + (error == null || error.isBlank() ? "unknown error" : error);
                if (compositeRepo.markFailed(composite.getId(), message, clock.instant()) == 1) {
                    LOGGER.error("COMPOSITE FAILED id={} error={}", composite.getId(), message);
                }
            }
        }
    }

    private Optional<VideoResult> fetch(GenerationProvider.Target target, String handle) {
        try {
            return Optional.of(provider.result(target, handle));
        } catch (ProviderException e) {
            if (e.isRetryable()) {
                throw e;
            }
            LOGGER.warn("RESULT unusable target={} handle={} error={}", target, handle, e.getMessage());
            return Optional.empty();
        }
    }
}
