package com.example.reelbot_backend.service.queue;

import com.example.reelbot_backend.config.QueueProperties;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-process job registry. Every change to a job runs inside {@link ConcurrentHashMap#compute} on
 * its id, so writes to one job are serialized while different jobs proceed in parallel. The handle
 * index is only written from inside those critical sections.
 */
@Service
public class InMemoryJobQueue implements JobQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobQueue.class);

    static final String CANCELLED_ERROR = "Job cancelled by user";

    private static final Comparator<VideoJob> PENDING_ORDER = Comparator
            .comparingInt((VideoJob j) -> j.priority().weight()).reversed()
            .thenComparing(VideoJob::createdAt)
            .thenComparingLong(VideoJob::sequence);

    private static final Comparator<VideoJob> NEWEST_FIRST =
            Comparator.comparing(VideoJob::createdAt).thenComparingLong(VideoJob::sequence).reversed();

    private final ConcurrentHashMap<String, VideoJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> jobIdByHandle = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final QueueProperties properties;
    private final Clock clock;

    public InMemoryJobQueue(QueueProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public VideoJob create(String ownerId, String correlationId, JobPriority priority, Map<String, Object> metadata) {
        return create(ownerId, correlationId, priority, metadata, properties.getDefaultMaxRetries());
    }

    @Override
    public VideoJob create(String ownerId, String correlationId, JobPriority priority,
                           Map<String, Object> metadata, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Instant now = clock.instant();
        VideoJob job = new VideoJob(newJobId(now), ownerId, correlationId, JobStatus.PENDING,
                priority == null ? JobPriority.NORMAL : priority, 0, null, null, null, 0, maxRetries,
                now, now, null, null, metadata, sequence.incrementAndGet());
        jobs.put(job.id(), job);
        LOGGER.info("JOB CREATE id={} owner={} correlation={} priority={}", job.id(), ownerId, correlationId, job.priority());
        return job;
    }

    @Override
    public Optional<VideoJob> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Optional<VideoJob> startProcessing(String id, String providerHandle) {
        Objects.requireNonNull(providerHandle, "providerHandle");
        return mutate(id, job -> {
            if (job.status() != JobStatus.PENDING) {
                throw new IllegalStateException("Job " + id + " is " + job.status() + ", expected PENDING");
            }
            if (job.providerHandle() != null) {
                throw new IllegalStateException("Job " + id + " already bound to " + job.providerHandle());
            }
            String owner = jobIdByHandle.putIfAbsent(providerHandle, id);
            if (owner != null && !owner.equals(id)) {
                throw new IllegalStateException("Handle " + providerHandle + " already bound to job " + owner);
            }
            Instant now = clock.instant();
            return job.toBuilder()
                    .status(JobStatus.PROCESSING)
                    .providerHandle(providerHandle)
                    .progress(Math.max(job.progress(), 5))
                    .startedAt(job.startedAt() == null ? now : job.startedAt())
                    .build(now);
        });
    }

    @Override
    public Optional<VideoJob> updateProgress(String id, int progress) {
        return mutate(id, job -> progressed(job, progress));
    }

    @Override
    public Optional<VideoJob> updateProgress(String id, String expectedHandle, int progress) {
        return mutateAttempt(id, expectedHandle, job -> progressed(job, progress));
    }

    @Override
    public Optional<VideoJob> complete(String id, VideoResult result) {
        Objects.requireNonNull(result, "result");
        return mutate(id, job -> completed(job, result));
    }

    @Override
    public Optional<VideoJob> complete(String id, String expectedHandle, VideoResult result) {
        Objects.requireNonNull(result, "result");
        return mutateAttempt(id, expectedHandle, job -> completed(job, result));
    }

    @Override
    public Optional<VideoJob> fail(String id, String error) {
        return mutate(id, job -> failed(job, error));
    }

    @Override
    public Optional<VideoJob> fail(String id, String expectedHandle, String error) {
        return mutateAttempt(id, expectedHandle, job -> failed(job, error));
    }

    @Override
    public Optional<VideoJob> failPermanently(String id, String error) {
        return mutate(id, job -> job.status().isTerminal() ? job : terminate(job, error));
    }

    @Override
    public Optional<VideoJob> failPermanently(String id, String expectedHandle, String error) {
        return mutateAttempt(id, expectedHandle, job -> job.status().isTerminal() ? job : terminate(job, error));
    }

    @Override
    public Optional<VideoJob> cancel(String id) {
        return mutate(id, job -> job.status().isTerminal() ? job : terminate(job, CANCELLED_ERROR));
    }

    @Override
    public Optional<VideoJob> retry(String id) {
        return mutate(id, job -> {
            if (job.status() != JobStatus.FAILED) {
                throw new IllegalStateException("Job " + id + " is " + job.status() + ", only failed jobs can be retried");
            }
            if (!job.canRetry()) {
                throw new IllegalStateException("Job " + id + " exhausted its retry budget (" + job.maxRetries() + ")");
            }
            LOGGER.info("JOB RETRY id={} retry={}/{}", id, job.retryCount() + 1, job.maxRetries());
            return requeue(job, null);
        });
    }

    @Override
    public Optional<VideoJob> setPriority(String id, JobPriority priority) {
        Objects.requireNonNull(priority, "priority");
        return mutate(id, job -> {
            if (job.status().isTerminal()) {
                throw new IllegalStateException("Job " + id + " is " + job.status() + ", priority can no longer change");
            }
            if (job.priority() == priority) {
                return job;
            }
            return job.toBuilder().priority(priority).build(clock.instant());
        });
    }

    @Override
    public List<VideoJob> listPending() {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.PENDING)
                .sorted(PENDING_ORDER)
                .toList();
    }

    @Override
    public Optional<VideoJob> nextPending() {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.PENDING)
                .min(PENDING_ORDER);
    }

    @Override
    public Optional<VideoJob> findByProviderHandle(String providerHandle) {
        if (providerHandle == null) {
            return Optional.empty();
        }
        String id = jobIdByHandle.get(providerHandle);
        return id == null ? Optional.empty() : get(id);
    }

    @Override
    public List<VideoJob> listByOwner(String ownerId) {
        return jobs.values().stream()
                .filter(j -> Objects.equals(j.ownerId(), ownerId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<VideoJob> listByCorrelation(String correlationId) {
        return jobs.values().stream()
                .filter(j -> Objects.equals(j.correlationId(), correlationId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<VideoJob> listByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.status() == status)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public QueueStats stats() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        Map<JobPriority, Long> byPriority = new EnumMap<>(JobPriority.class);
        for (JobStatus s : JobStatus.values()) byStatus.put(s, 0L);
        for (JobPriority p : JobPriority.values()) byPriority.put(p, 0L);
        int total = 0;
        for (VideoJob job : jobs.values()) {
            total++;
            byStatus.merge(job.status(), 1L, Long::sum);
            byPriority.merge(job.priority(), 1L, Long::sum);
        }
        return new QueueStats(total, byStatus, byPriority);
    }

    @Override
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        AtomicReference<VideoJob> removed = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, job) -> {
            unbind(job);
            removed.set(job);
            return null;
        });
        return removed.get() != null;
    }

    @Override
    @Scheduled(fixedDelayString = "${queue.cleanup-interval:PT5M}", initialDelayString = "${queue.cleanup-interval:PT5M}")
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (String id : jobs.keySet()) {
            AtomicReference<VideoJob> evicted = new AtomicReference<>();
            jobs.computeIfPresent(id, (key, job) -> {
                if (!isExpired(job, now)) {
                    return job;
                }
                unbind(job);
                evicted.set(job);
                return null;
            });
            if (evicted.get() != null) {
                removed++;
            }
        }
        if (removed > 0) {
            LOGGER.info("QUEUE EVICT removed={} remaining={}", removed, jobs.size());
        }
        return removed;
    }

    private boolean isExpired(VideoJob job, Instant now) {
        Duration idle = Duration.between(job.updatedAt(), now);
        return switch (job.status()) {
            case COMPLETED -> idle.compareTo(properties.getCompletedRetention()) > 0;
            case FAILED -> idle.compareTo(properties.getFailedRetention()) > 0;
            case PENDING, PROCESSING -> false;
        };
    }

    private VideoJob progressed(VideoJob job, int progress) {
        int clamped = Math.max(0, Math.min(100, progress));
        if (job.status().isTerminal() || clamped <= job.progress()) {
            return job;
        }
        return job.toBuilder().progress(clamped).build(clock.instant());
    }

    private VideoJob completed(VideoJob job, VideoResult result) {
        if (job.status().isTerminal()) {
            LOGGER.debug("JOB COMPLETE ignored id={} status={}", job.id(), job.status());
            return job;
        }
        Instant now = clock.instant();
        return job.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(100)
                .result(result)
                .error(null)
                .completedAt(job.completedAt() == null ? now : job.completedAt())
                .build(now);
    }

    private VideoJob failed(VideoJob job, String error) {
        if (job.status().isTerminal()) {
            return job;
        }
        if (job.canRetry()) {
            LOGGER.info("JOB REQUEUE id={} retry={}/{} error={}", job.id(), job.retryCount() + 1, job.maxRetries(), error);
            return requeue(job, error);
        }
        return terminate(job, error);
    }

    /**
     * Applies {@code change} only while the job is bound to {@code expectedHandle}; the check and the
     * change share the same critical section.
     */
    private Optional<VideoJob> mutateAttempt(String id, String expectedHandle, UnaryOperator<VideoJob> change) {
        Objects.requireNonNull(expectedHandle, "expectedHandle");
        return mutate(id, job -> {
            if (!expectedHandle.equals(job.providerHandle())) {
                LOGGER.debug("JOB stale report ignored id={} handle={} bound={}", job.id(), expectedHandle, job.providerHandle());
                return job;
            }
            return change.apply(job);
        });
    }

    private Optional<VideoJob> mutate(String id, UnaryOperator<VideoJob> change) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, job) -> change.apply(job)));
    }

    private VideoJob requeue(VideoJob job, String error) {
        unbind(job);
        return job.toBuilder()
                .status(JobStatus.PENDING)
                .retryCount(job.retryCount() + 1)
                .progress(0)
                .providerHandle(null)
                .error(error)
                .build(clock.instant());
    }

    private VideoJob terminate(VideoJob job, String error) {
        Instant now = clock.instant();
        LOGGER.warn("JOB FAILED id={} retries={}/{} error={}", job.id(), job.retryCount(), job.maxRetries(), error);
        return job.toBuilder()
                .status(JobStatus.FAILED)
                .error(error)
                .completedAt(job.completedAt() == null ? now : job.completedAt())
                .build(now);
    }

    private void unbind(VideoJob job) {
        if (job.providerHandle() != null) {
            jobIdByHandle.remove(job.providerHandle(), job.id());
        }
    }

    private static String newJobId(Instant now) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "job_" + Long.toString(now.toEpochMilli(), 36) + "_" + random.substring(0, Math.min(8, random.length()));
    }
}
