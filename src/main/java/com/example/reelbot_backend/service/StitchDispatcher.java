package com.example.reelbot_backend.service;

import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.repository.CompositeClipRepository;
import com.example.reelbot_backend.repository.CompositeVideoRepository;
import com.example.reelbot_backend.util.CompositeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Submits the final merge of all clip videos once a composite has entered STITCHING.
 */
@Service
public class StitchDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(StitchDispatcher.class);

    private final CompositeVideoRepository compositeRepo;
    private final CompositeClipRepository clipRepo;
    private final GenerationProvider provider;
    private final TaskExecutor executor;
    private final Clock clock;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public StitchDispatcher(CompositeVideoRepository compositeRepo,
                            CompositeClipRepository clipRepo,
                            GenerationProvider provider,
                            @Qualifier("dispatchTaskExecutor") TaskExecutor executor,
                            Clock clock) {
        this.compositeRepo = compositeRepo;
        this.clipRepo = clipRepo;
        this.provider = provider;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Schedules a stitch submission unless one is already running for this composite.
     *
     * @return {@code false} when a submission for the composite is already in progress.
     */
    public boolean dispatchAsync(UUID compositeId) {
        if (!inFlight.add(compositeId)) {
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    dispatch(compositeId);
                } finally {
                    inFlight.remove(compositeId);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(compositeId);
            LOGGER.warn("STITCH schedule rejected composite={} error={}", compositeId, e.toString());
            return false;
        }
        return true;
    }

    void dispatch(UUID compositeId) {
        CompositeVideo composite = compositeRepo.findById(compositeId).orElse(null);
        if (composite == null || composite.getStatus() != CompositeStatus.STITCHING || composite.getStitchHandle() != null) {
            LOGGER.debug("STITCH skip composite={} state={}", compositeId, composite == null ? "missing" : composite.getStatus());
            return;
        }
        List<String> urls = clipRepo.findByCompositeIdOrderByClipIndexAsc(compositeId).stream()
                .map(CompositeClip::getVideoUrl)
                .toList();
        if (urls.size() != composite.getTotalClips() || urls.stream().anyMatch(u -> u == null || u.isBlank())) {
            compositeRepo.markFailed(compositeId, "Stitching requires a video for every clip", clock.instant());
            LOGGER.error("STITCH invalid composite={} urls={} expected={}", compositeId, urls.size(), composite.getTotalClips());
            return;
        }
        try {
            String handle = provider.submitStitch(new GenerationProvider.StitchRequest(urls, composite.getAspectRatio().providerRatio()));
            int bound = compositeRepo.bindStitchHandle(compositeId, handle, clock.instant());
            LOGGER.info("STITCH SUBMIT composite={} handle={} clips={} bound={}", compositeId, handle, urls.size(), bound == 1);
        } catch (ProviderException e) {
            if (e.isRetryable()) {
                LOGGER.warn("STITCH submit deferred composite={} error={}", compositeId, e.getMessage());
            } else {
                compositeRepo.markFailed(compositeId, "Stitching failed: " + e.getMessage(), clock.instant());
                LOGGER.error("STITCH submit rejected composite={} error={}", compositeId, e.getMessage());
            }
        }
    }
}
