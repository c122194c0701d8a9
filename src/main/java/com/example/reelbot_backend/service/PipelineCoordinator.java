package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.PipelineProperties;
import com.example.reelbot_backend.dto.composite.CompositeStartRequest;
import com.example.reelbot_backend.dto.composite.CompositeStartResponse;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.repository.CompositeClipRepository;
import com.example.reelbot_backend.repository.CompositeVideoRepository;
import com.example.reelbot_backend.service.Interfaces.ActorDirectory;
import com.example.reelbot_backend.service.pipeline.ScriptSegment;
import com.example.reelbot_backend.service.pipeline.ScriptSegmenter;
import com.example.reelbot_backend.service.pipeline.SegmentationResult;
import com.example.reelbot_backend.util.AspectRatio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Breaks a composite request into clip records and moves the composite to STITCHING once every
 * clip is done. Clip generation itself is driven by {@link DispatchWorker}.
 */
@Service
public class PipelineCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineCoordinator.class);

    static final Set<String> SUPPORTED_VOICES = Set.of("alloy", "echo", "fable", "onyx", "nova", "shimmer");
    static final String DEFAULT_VOICE = "nova";
    static final int MIN_TARGET_DURATION = 5;
    static final int MAX_TARGET_DURATION = 120;
    private static final int MIN_SCRIPT_WORDS = 3;

    private final CompositeVideoRepository compositeRepo;
    private final CompositeClipRepository clipRepo;
    private final ScriptSegmenter segmenter;
    private final ActorDirectory actors;
    private final StitchDispatcher stitchDispatcher;
    private final PipelineProperties props;
    private final Clock clock;

    public PipelineCoordinator(CompositeVideoRepository compositeRepo,
                               CompositeClipRepository clipRepo,
                               ScriptSegmenter segmenter,
                               ActorDirectory actors,
                               StitchDispatcher stitchDispatcher,
                               PipelineProperties props,
                               Clock clock) {
        this.compositeRepo = compositeRepo;
        this.clipRepo = clipRepo;
        this.segmenter = segmenter;
        this.actors = actors;
        this.stitchDispatcher = stitchDispatcher;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    public CompositeStartResponse start(CompositeStartRequest request) {
        String script = request.script();
        if (script == null || script.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "SCRIPT_REQUIRED");
        }
        if (ScriptSegmenter.wordCount(script) < MIN_SCRIPT_WORDS) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "SCRIPT_TOO_SHORT");
        }
        ActorDirectory.Actor actor = actors.findActive(request.actorId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "ACTOR_NOT_FOUND"));

        String voice = firstNonBlank(request.voiceId(), actor.defaultVoiceId(), DEFAULT_VOICE).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_VOICES.contains(voice)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_VOICE");
        }
        AspectRatio ratio = request.aspectRatio() == null ? AspectRatio.PORTRAIT
                : AspectRatio.fromLabel(request.aspectRatio())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_ASPECT_RATIO"));
        int target = request.targetDuration() == null ? props.getDefaultTargetDuration() : request.targetDuration();
        if (target < MIN_TARGET_DURATION || target > MAX_TARGET_DURATION) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_TARGET_DURATION");
        }

        SegmentationResult segments = segmenter.segment(script, target, props.getMaxClipDuration());
        SegmentationResult.Validation validation = segmenter.validate(segments, segments.clipCount(), props.getMaxClipDuration());
        if (!validation.valid()) {
            LOGGER.warn("COMPOSITE segmentation fallback reviewId={} errors={}", request.reviewId(), validation.errors());
            segments = segmenter.simpleSegment(script);
        }

        CompositeVideo composite = compositeRepo.save(new CompositeVideo(request.ownerId(), request.reviewId(),
                actor.id(), voice, script.trim(), ratio, target, segments.clipCount()));
        for (ScriptSegment s : segments.segments()) {
            clipRepo.save(new CompositeClip(composite.getId(), s.order(), s.type(), s.content()));
        }
        compositeRepo.markGeneratingClips(composite.getId(), clock.instant());

        LOGGER.info("COMPOSITE START id={} owner={} review={} actor={} clips={} target={}s",
                composite.getId(), request.ownerId(), request.reviewId(), actor.id(), segments.clipCount(), target);
        return new CompositeStartResponse(composite.getId(), "generating_clips", segments.clipCount(),
                segments.clipCount() * props.getSecondsPerClipEstimate());
    }

    /**
     * Attempts the GENERATING_CLIPS to STITCHING transition after a clip finished. Exactly one of
     * several concurrent callers wins and triggers the stitch submission.
     *
     * @return {@code true} when this call moved the composite to STITCHING.
     */
    public boolean onClipCompleted(UUID compositeId) {
        int won = compositeRepo.markStitching(compositeId, clock.instant());
        if (won == 1) {
            LOGGER.info("COMPOSITE STITCHING id={}", compositeId);
            stitchDispatcher.dispatchAsync(compositeId);
            return true;
        }
        LOGGER.debug("COMPOSITE not ready for stitching id={}", compositeId);
        return false;
    }

    public void retryClip(UUID compositeId, int clipIndex) {
        CompositeVideo composite = require(compositeId);
        if (composite.getStatus().isTerminal()) {
            throw new IllegalStateException("Composite " + compositeId + " is " + composite.getStatus());
        }
        CompositeClip clip = clipRepo.findByCompositeIdAndClipIndex(compositeId, clipIndex)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "CLIP_NOT_FOUND"));
        if (clipRepo.resetFailed(clip.getId(), clock.instant()) == 0) {
            throw new IllegalStateException("Clip " + clipIndex + " of composite " + compositeId + " is not failed");
        }
        LOGGER.info("COMPOSITE CLIP RETRY id={} clip={}", compositeId, clipIndex);
    }

    public void fail(UUID compositeId, String reason) {
        require(compositeId);
        String message = reason == null || reason.isBlank() ? "Failed by operator" : reason;
        if (compositeRepo.markFailed(compositeId, message, clock.instant()) == 0) {
            throw new IllegalStateException("Composite " + compositeId + " is already finished");
        }
        LOGGER.warn("COMPOSITE FAILED id={} reason={}", compositeId, message);
    }

    @Transactional
    public void delete(UUID compositeId) {
        require(compositeId);
        long clips = clipRepo.deleteByCompositeId(compositeId);
        compositeRepo.deleteById(compositeId);
        LOGGER.info("COMPOSITE DELETE id={} clips={}", compositeId, clips);
    }

    private CompositeVideo require(UUID compositeId) {
        return compositeRepo.findById(compositeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "COMPOSITE_NOT_FOUND"));
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }
}
