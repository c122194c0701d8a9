package com.example.reelbot_backend.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.reelbot_backend.config.QueueProperties;
import com.example.reelbot_backend.dto.webhook.ProviderWebhookPayload;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.service.queue.InMemoryJobQueue;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import com.example.reelbot_backend.util.ProviderState;
import com.example.reelbot_backend.util.UnknownProviderStateException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusReconcilerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryJobQueue queue;
    private CompositeReconciler compositeReconciler;
    private GenerationProvider provider;
    private StatusReconciler reconciler;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(new QueueProperties(), Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
        compositeReconciler = mock(CompositeReconciler.class);
        provider = mock(GenerationProvider.class);
        reconciler = new StatusReconciler(queue, compositeReconciler, provider);
    }

    private VideoJob processingJob(String handle) {
        VideoJob job = queue.create("owner", "review", JobPriority.NORMAL, Map.of("durationSeconds", 10));
        return queue.startProcessing(job.id(), handle).orElseThrow();
    }

    private ProviderWebhookPayload webhook(String handle, String status, Integer position, String payloadJson, String error)
            throws Exception {
        JsonNode payload = payloadJson == null ? null : mapper.readTree(payloadJson);
        return new ProviderWebhookPayload(handle, status, position, payload, error);
    }

    @Test
    void queuePositionMapsToEarlyProgress() throws Exception {
        VideoJob job = processingJob("req-1");

        StatusReconciler.Outcome outcome = reconciler.onWebhook(webhook("req-1", "IN_QUEUE", 3, null, null));

        assertThat(outcome).isEqualTo(StatusReconciler.Outcome.JOB);
        assertThat(queue.get(job.id())).map(VideoJob::progress).contains(19);
        assertThat(StatusReconciler.queueProgress(null)).isEqualTo(10);
        assertThat(StatusReconciler.queueProgress(40)).isEqualTo(5);
    }

    @Test
    void inProgressThenCompletedFinishesJob() throws Exception {
        VideoJob job = processingJob("req-2");

        reconciler.onWebhook(webhook("req-2", "IN_PROGRESS", null, null, null));
        assertThat(queue.get(job.id())).map(VideoJob::progress).contains(50);

        reconciler.onWebhook(webhook("req-2", "COMPLETED", null,
                "{\"video\":{\"url\":\"https://cdn.example.com/out.mp4\",\"content_type\":\"video/mp4\"}}", null));

        VideoJob done = queue.get(job.id()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.result().url()).isEqualTo("https://cdn.example.com/out.mp4");
        assertThat(done.result().durationSeconds()).isEqualTo(10.0);
    }

    @Test
    void duplicateCompletionKeepsFirstResult() throws Exception {
        VideoJob job = processingJob("req-3");
        reconciler.onWebhook(webhook("req-3", "COMPLETED", null, "{\"video_url\":\"https://cdn/a.mp4\"}", null));

        reconciler.onWebhook(webhook("req-3", "COMPLETED", null, "{\"video_url\":\"https://cdn/b.mp4\"}", null));

        assertThat(queue.get(job.id()).orElseThrow().result().url()).isEqualTo("https://cdn/a.mp4");
    }

    @Test
    void completionWithoutVideoCountsAsFailure() throws Exception {
        VideoJob job = processingJob("req-4");

        reconciler.onWebhook(webhook("req-4", "COMPLETED", null, "{}", null));

        VideoJob after = queue.get(job.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.PENDING);
        assertThat(after.retryCount()).isEqualTo(1);
        assertThat(after.error()).isEqualTo(StatusReconciler.NO_VIDEO_URL);
    }

    @Test
    void retryableFailureRequeuesAndTerminalFailureDoesNot() throws Exception {
        VideoJob transientJob = processingJob("req-5");
        VideoJob policyJob = processingJob("req-6");

        reconciler.onWebhook(webhook("req-5", "FAILED", null, null, "Rate limit exceeded"));
        reconciler.onWebhook(webhook("req-6", "FAILED", null, null, "Content policy violation"));

        assertThat(queue.get(transientJob.id())).map(VideoJob::status).contains(JobStatus.PENDING);
        VideoJob policy = queue.get(policyJob.id()).orElseThrow();
        assertThat(policy.status()).isEqualTo(JobStatus.FAILED);
        assertThat(policy.retryCount()).isZero();
    }

    @Test
    void unknownHandleFallsThroughToCompositeStages() throws Exception {
        when(compositeReconciler.onClipUpdate(eq("clip-h"), eq(ProviderState.IN_PROGRESS), any(), any())).thenReturn(true);

        assertThat(reconciler.onWebhook(webhook("clip-h", "IN_PROGRESS", null, null, null)))
                .isEqualTo(StatusReconciler.Outcome.CLIP);

        when(compositeReconciler.onStitchUpdate(eq("stitch-h"), eq(ProviderState.COMPLETED), any(), eq("https://cdn/t.jpg"), any()))
                .thenReturn(true);
        assertThat(reconciler.onWebhook(webhook("stitch-h", "COMPLETED", null,
                "{\"video\":{\"url\":\"https://cdn/f.mp4\"},\"thumbnail\":{\"url\":\"https://cdn/t.jpg\"}}", null)))
                .isEqualTo(StatusReconciler.Outcome.STITCH);

        assertThat(reconciler.onWebhook(webhook("nobody", "COMPLETED", null, null, null)))
                .isEqualTo(StatusReconciler.Outcome.UNMATCHED);
    }

    @Test
    void unmatchedNotificationIsLoggedAsWarning() throws Exception {
        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(StatusReconciler.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        try {
            reconciler.onWebhook(webhook("stale-handle", "FAILED", null, null, "boom"));

            List<String> warnings = listAppender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage)
                    .toList();
            assertThat(warnings).anyMatch(m -> m.contains("unmatched") && m.contains("stale-handle"));
        } finally {
            logger.detachAppender(listAppender);
            listAppender.stop();
        }
    }

    @Test
    void unknownStateIsRejectedBeforeRouting() {
        processingJob("req-7");

        assertThatThrownBy(() -> reconciler.onWebhook(webhook("req-7", "PAUSED", null, null, null)))
                .isInstanceOf(UnknownProviderStateException.class);
        verify(compositeReconciler, never()).onClipUpdate(anyString(), any(), any(), any());
    }

    @Test
    void pollLeavesJobAloneWhenProviderIsUnreachable() {
        VideoJob job = processingJob("req-8");
        when(provider.status(GenerationProvider.Target.VIDEO, "req-8"))
                .thenThrow(new ProviderException("status unavailable", true));

        reconciler.pollJob(job.id());

        VideoJob after = queue.get(job.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(after.retryCount()).isZero();
    }

    @Test
    void pollAppliesProviderState() {
        VideoJob job = processingJob("req-9");
        when(provider.status(GenerationProvider.Target.VIDEO, "req-9"))
                .thenReturn(new GenerationProvider.ProviderStatus(ProviderState.IN_PROGRESS, null, null));

        reconciler.pollJob(job.id());

        assertThat(queue.get(job.id())).map(VideoJob::progress).contains(50);
    }

    @Test
    void failureSeenByWebhookAndPollChargesRetryBudgetOnce() {
        VideoJob job = processingJob("req-10");
        when(provider.status(GenerationProvider.Target.VIDEO, "req-10")).thenAnswer(invocation -> {
            reconciler.onWebhook(webhook("req-10", "FAILED", null, null, "rate limit exceeded"));
            return new GenerationProvider.ProviderStatus(ProviderState.FAILED, null, "rate limit exceeded");
        });

        reconciler.pollJob(job.id());

        VideoJob after = queue.get(job.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.PENDING);
        assertThat(after.retryCount()).isEqualTo(1);
        assertThat(after.providerHandle()).isNull();
    }

    @Test
    void lateReportForEarlierAttemptLeavesResubmittedJobAlone() {
        VideoJob job = processingJob("req-11");
        VideoJob firstAttempt = queue.get(job.id()).orElseThrow();
        queue.fail(job.id(), "req-11", "timeout");
        queue.startProcessing(job.id(), "req-12");

        reconciler.apply(firstAttempt, ProviderState.FAILED, null, Optional::empty, "content policy violation");

        VideoJob after = queue.get(job.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(after.providerHandle()).isEqualTo("req-12");
        assertThat(after.retryCount()).isEqualTo(1);
    }
}
