package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.PipelineProperties;
import com.example.reelbot_backend.config.ProgressProperties;
import com.example.reelbot_backend.dto.progress.ClipProgress;
import com.example.reelbot_backend.dto.progress.ProgressSnapshot;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.ClipStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pure mapping from stored state to client-facing progress. Never mutates anything.
 */
@Component
public class ProgressCalculator {
    private final ProgressProperties props;
    private final PipelineProperties pipeline;
    private final Clock clock;

    public ProgressCalculator(ProgressProperties props, PipelineProperties pipeline, Clock clock) {
        this.props = props;
        this.pipeline = pipeline;
        this.clock = clock;
    }

    public ProgressSnapshot forJob(VideoJob job) {
        String stage = switch (job.status()) {
            case COMPLETED -> "complete";
            case FAILED -> "error";
            case PENDING -> "script";
            case PROCESSING -> stageFor(job.progress());
        };
        String status = switch (job.status()) {
            case COMPLETED -> "complete";
            case FAILED -> "error";
            case PENDING -> "queued";
            case PROCESSING -> "generating";
        };
        int eta = job.status().isTerminal() ? 0 : estimateRemaining(job.progress(), job.startedAt());
        return new ProgressSnapshot(
                job.id(),
                stage,
                stageProgress(job.progress()),
                job.progress(),
                eta,
                status,
                job.result() == null ? null : job.result().url(),
                null,
                job.error(),
                job.createdAt(),
                job.updatedAt(),
                job.startedAt(),
                job.completedAt(),
                job.priority().name().toLowerCase(Locale.ROOT),
                job.retryCount(),
                null,
                null,
                null
        );
    }

    public ProgressSnapshot forComposite(CompositeVideo composite, List<CompositeClip> clips) {
        int total = composite.getTotalClips();
        int done = (int) clips.stream().filter(c -> c.getStatus() == ClipStatus.COMPLETED).count();
        int overall = compositeProgress(composite, done);
        int perClip = pipeline.getSecondsPerClipEstimate();
        CompositeStage phase = switch (composite.getStatus()) {
            case PENDING -> new CompositeStage("script", "queued", 0, total * perClip);
            case GENERATING_CLIPS -> new CompositeStage("video", "generating",
                    total == 0 ? 0 : (int) Math.round(done * 100.0 / total),
                    (total - done) * perClip + props.getDefaultEstimateSeconds());
            case STITCHING -> new CompositeStage("processing", "generating", 50, props.getDefaultEstimateSeconds());
            case COMPLETED -> new CompositeStage("complete", "complete", 100, 0);
            case FAILED -> new CompositeStage("error", "error", 0, 0);
        };
        String error = composite.getErrorMessage();
        if (error == null && !composite.getStatus().isTerminal()) {
            // a failed clip blocks the composite until an operator acts
            error = firstClipFailure(clips).orElse(null);
        }
        List<ClipProgress> clipViews = clips.stream()
                .map(c -> new ClipProgress(c.getClipIndex(), c.getClipType().name().toLowerCase(Locale.ROOT),
                        c.getStatus().name().toLowerCase(Locale.ROOT), clipProgress(c.getStatus()),
                        c.getVideoUrl(), c.getErrorMessage()))
                .toList();
        return new ProgressSnapshot(
                composite.getId().toString(),
                phase.stage(),
                phase.stageProgress(),
                overall,
                phase.eta(),
                phase.status(),
                composite.getFinalVideoUrl(),
                composite.getThumbnailUrl(),
                error,
                composite.getCreatedAt(),
                composite.getUpdatedAt(),
                null,
                composite.getCompletedAt(),
                null,
                null,
                done,
                total,
                clipViews
        );
    }

    public static int compositeProgress(CompositeVideo composite, int completedClips) {
        return switch (composite.getStatus()) {
            case COMPLETED -> 100;
            case STITCHING -> 90;
            case GENERATING_CLIPS -> composite.getTotalClips() == 0 ? 0
                    : (int) Math.round(completedClips * 80.0 / composite.getTotalClips());
            case PENDING, FAILED -> 0;
        };
    }

    public static int clipProgress(ClipStatus status) {
        return switch (status) {
            case COMPLETED -> 100;
            case PENDING -> 0;
            case GENERATING_AUDIO, GENERATING_VIDEO, FAILED -> 50;
        };
    }

    String stageFor(int progress) {
        ProgressProperties.Bands b = props.getBands();
        if (progress < b.getAudio()) return "script";
        if (progress < b.getVideo()) return "audio";
        if (progress < b.getProcessing()) return "video";
        return "processing";
    }

    int stageProgress(int progress) {
        ProgressProperties.Bands b = props.getBands();
        double value;
        if (progress < b.getAudio()) {
            value = within(progress, 0, b.getAudio());
        } else if (progress < b.getVideo()) {
            value = within(progress, b.getAudio(), b.getVideo());
        } else if (progress < b.getProcessing()) {
            value = within(progress, b.getVideo(), b.getProcessing());
        } else {
            value = within(progress, b.getProcessing(), 100);
        }
        return (int) Math.round(value);
    }

    int estimateRemaining(int progress, Instant startedAt) {
        if (startedAt == null || progress <= 0) {
            return props.getDefaultEstimateSeconds();
        }
        if (progress >= 100) {
            return 0;
        }
        double elapsed = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        double remaining = elapsed / progress * 100 - elapsed;
        return (int) Math.round(Math.max(0, Math.min(remaining, props.getMaxEstimateSeconds())));
    }

    private static double within(int progress, int lower, int upper) {
        if (upper <= lower) {
            return 100;
        }
        return (progress - lower) * 100.0 / (upper - lower);
    }

    private static Optional<String> firstClipFailure(List<CompositeClip> clips) {
        return clips.stream()
                .filter(c -> c.getStatus() == ClipStatus.FAILED)
                .findFirst()
                .map(c -> "Clip " + c.getClipIndex() + " failed: " + c.getErrorMessage());
    }

    private record CompositeStage(String stage, String status, int stageProgress, int eta) {}
}
