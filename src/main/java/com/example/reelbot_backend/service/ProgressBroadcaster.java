package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.ProgressProperties;
import com.example.reelbot_backend.config.ProviderProperties;
import com.example.reelbot_backend.dto.progress.ProgressSnapshot;
import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.repository.CompositeClipRepository;
import com.example.reelbot_backend.repository.CompositeVideoRepository;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.util.ClipStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-side view of job progress, as one-shot snapshots or as an SSE stream. Provider syncs go
 * through the reconcilers; nothing here writes job state directly.
 */
@Service
public class ProgressBroadcaster {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressBroadcaster.class);
    static final String NOT_FOUND = "Job not found";
    static final String SESSION_TIMEOUT = "Polling timeout - job still in progress";

    private final JobQueue queue;
    private final StatusReconciler statusReconciler;
    private final CompositeReconciler compositeReconciler;
    private final CompositeVideoRepository compositeRepo;
    private final CompositeClipRepository clipRepo;
    private final ProgressCalculator calculator;
    private final ProgressProperties props;
    private final ProviderProperties providerProps;
    private final Clock clock;
    private final Scheduler syncScheduler;

    @Autowired
    public ProgressBroadcaster(JobQueue queue,
                               StatusReconciler statusReconciler,
                               CompositeReconciler compositeReconciler,
                               CompositeVideoRepository compositeRepo,
                               CompositeClipRepository clipRepo,
                               ProgressCalculator calculator,
                               ProgressProperties props,
                               ProviderProperties providerProps,
                               Clock clock) {
        this(queue, statusReconciler, compositeReconciler, compositeRepo, clipRepo, calculator, props, providerProps,
                clock, Schedulers.boundedElastic());
    }

    ProgressBroadcaster(JobQueue queue,
                        StatusReconciler statusReconciler,
                        CompositeReconciler compositeReconciler,
                        CompositeVideoRepository compositeRepo,
                        CompositeClipRepository clipRepo,
                        ProgressCalculator calculator,
                        ProgressProperties props,
                        ProviderProperties providerProps,
                        Clock clock,
                        Scheduler syncScheduler) {
        this.queue = queue;
        this.statusReconciler = statusReconciler;
        this.compositeReconciler = compositeReconciler;
        this.compositeRepo = compositeRepo;
        this.clipRepo = clipRepo;
        this.calculator = calculator;
        this.props = props;
        this.providerProps = providerProps;
        this.clock = clock;
        this.syncScheduler = syncScheduler;
    }

    public Optional<ProgressSnapshot> jobSnapshot(String jobId) {
        statusReconciler.pollJob(jobId);
        return readJob(jobId);
    }

    public Optional<ProgressSnapshot> compositeSnapshot(UUID compositeId) {
        syncComposite(compositeId);
        return readComposite(compositeId);
    }

    /**
     * Stored state of an owner's composites, newest first. No provider sync is done for listings.
     */
    public List<ProgressSnapshot> compositesForOwner(String ownerId) {
        return compositeRepo.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(c -> calculator.forComposite(c, clipRepo.findByCompositeIdOrderByClipIndexAsc(c.getId())))
                .toList();
    }

    public Flux<ServerSentEvent<ProgressSnapshot>> streamJob(String jobId) {
        return stream(jobId, () -> statusReconciler.pollJob(jobId), () -> readJob(jobId));
    }

    public Flux<ServerSentEvent<ProgressSnapshot>> streamComposite(UUID compositeId) {
        return stream(compositeId.toString(), () -> syncComposite(compositeId), () -> readComposite(compositeId));
    }

    /**
     * Emits a snapshot every tick and syncs with the provider every {@code syncEvery} ticks. The
     * stream ends after a terminal snapshot, or with a timeout snapshot once the session limit is
     * reached. Cancelling the subscription only stops the loop.
     */
    private Flux<ServerSentEvent<ProgressSnapshot>> stream(String id, Runnable sync,
                                                           Supplier<Optional<ProgressSnapshot>> read) {
        return Flux.defer(() -> {
            if (read.get().isEmpty()) {
                return Flux.just(ProgressSnapshot.error(id, NOT_FOUND, clock.instant()));
            }
            Duration tick = props.getTick();
            long maxTicks = Math.max(1, props.getMaxSession().toMillis() / Math.max(1, tick.toMillis()));
            int syncEvery = Math.max(1, props.getSyncEvery());
            AtomicBoolean finished = new AtomicBoolean(false);
            AtomicLong lastSyncTick = new AtomicLong(-syncEvery);

            // ticks that arrive while a slow sync or read is running are dropped, not buffered
            Flux<ProgressSnapshot> ticks = Flux.interval(Duration.ZERO, tick)
                    .take(maxTicks)
                    .onBackpressureDrop(n -> LOGGER.debug("PROGRESS tick skipped id={} tick={}", id, n))
                    .concatMap(n -> (syncDue(n, lastSyncTick, syncEvery) ? syncQuietly(id, sync) : Mono.<Void>empty())
                            .then(Mono.fromSupplier(() -> read.get()
                                    .orElseGet(() -> ProgressSnapshot.error(id, NOT_FOUND, clock.instant())))), 1)
                    .takeUntil(ProgressSnapshot::isTerminal)
                    .doOnNext(s -> {
                        if (s.isTerminal()) finished.set(true);
                    });

            return ticks.concatWith(Mono.defer(() -> finished.get()
                    ? Mono.empty()
                    : Mono.fromSupplier(() -> {
                        LOGGER.info("PROGRESS session limit reached id={}", id);
                        return ProgressSnapshot.error(id, SESSION_TIMEOUT, clock.instant());
                    })));
        })
                .map(s -> ServerSentEvent.builder(s).event("progress").build())
                .doOnCancel(() -> LOGGER.debug("PROGRESS subscriber left id={}", id));
    }

    private static boolean syncDue(long tick, AtomicLong lastSyncTick, int syncEvery) {
        if (tick - lastSyncTick.get() < syncEvery) {
            return false;
        }
        lastSyncTick.set(tick);
        return true;
    }

    private Mono<Void> syncQuietly(String id, Runnable sync) {
        Duration timeout = Duration.ofSeconds(Math.max(1, providerProps.getTimeoutSeconds()));
        return Mono.fromRunnable(sync)
                .subscribeOn(syncScheduler)
                .timeout(timeout)
                .onErrorResume(e -> {
                    LOGGER.warn("PROGRESS sync failed id={} error={}", id, e.toString());
                    return Mono.empty();
                })
                .then();
    }

    private void syncComposite(UUID compositeId) {
        Optional<CompositeVideo> composite = compositeRepo.findById(compositeId);
        if (composite.isEmpty() || composite.get().getStatus().isTerminal()) {
            return;
        }
        for (CompositeClip clip : clipRepo.findByCompositeIdOrderByClipIndexAsc(compositeId)) {
            if (ClipStatus.IN_FLIGHT.contains(clip.getStatus()) && clip.getProviderHandle() != null) {
                compositeReconciler.pollClip(clip);
            }
        }
        compositeRepo.findById(compositeId).ifPresent(compositeReconciler::pollStitch);
    }

    private Optional<ProgressSnapshot> readJob(String jobId) {
        return queue.get(jobId).map(calculator::forJob);
    }

    private Optional<ProgressSnapshot> readComposite(UUID compositeId) {
        return compositeRepo.findById(compositeId).map(c -> {
            List<CompositeClip> clips = clipRepo.findByCompositeIdOrderByClipIndexAsc(compositeId);
            return calculator.forComposite(c, clips);
        });
    }
}
