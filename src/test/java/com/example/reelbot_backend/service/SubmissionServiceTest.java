package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.ProviderProperties;
import com.example.reelbot_backend.config.QueueProperties;
import com.example.reelbot_backend.dto.generation.SubmitGenerationRequest;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.engine.ProviderException;
import com.example.reelbot_backend.service.queue.InMemoryJobQueue;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubmissionServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
    private InMemoryJobQueue queue;
    private GenerationProvider provider;
    private ProviderProperties providerProps;
    private SubmissionService service;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(new QueueProperties(), clock);
        provider = mock(GenerationProvider.class);
        providerProps = new ProviderProperties();
        providerProps.setApiKey("key");
        service = new SubmissionService(queue, provider, new TestimonialPromptBuilder(), providerProps, clock);
    }

    private static SubmitGenerationRequest request(String ratio, Integer duration, String priority) {
        return new SubmitGenerationRequest(null, null, "Loved the coffee and the cozy corner seats.", "Ana",
                "Bean There", "energetic", ratio, duration, priority);
    }

    @Test
    void successfulSubmissionStartsProcessing() {
        when(provider.submit(any())).thenReturn("req-42");

        VideoJob job = service.submit(request("16:9", 10, "high"));

        assertThat(job.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.providerHandle()).isEqualTo("req-42");
        assertThat(job.ownerId()).isEqualTo(SubmissionService.ANONYMOUS_OWNER);
        assertThat(job.correlationId()).startsWith("review_");
        assertThat(job.priority()).isEqualTo(JobPriority.HIGH);
        assertThat(job.metadata()).containsEntry("aspectRatio", "16:9").containsEntry("durationSeconds", 10)
                .containsEntry("businessName", "Bean There");

        ArgumentCaptor<GenerationProvider.GenerationRequest> captor =
                ArgumentCaptor.forClass(GenerationProvider.GenerationRequest.class);
        verify(provider).submit(captor.capture());
        assertThat(captor.getValue().target()).isEqualTo(GenerationProvider.Target.VIDEO);
        assertThat(captor.getValue().aspectRatio()).isEqualTo("16:9");
        assertThat(captor.getValue().durationSeconds()).isEqualTo(10);
        assertThat(captor.getValue().prompt()).contains("Bean There");
    }

    @Test
    void retryableProviderErrorLeavesJobQueued() {
        when(provider.submit(any())).thenThrow(new ProviderException("429 Too Many Requests", true));

        VideoJob job = service.submit(request(null, null, null));

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.retryCount()).isEqualTo(1);
        assertThat(job.metadata()).containsEntry("durationSeconds", 5).containsEntry("aspectRatio", "9:16");
    }

    @Test
    void terminalProviderErrorFailsJob() {
        when(provider.submit(any())).thenThrow(new ProviderException("422 invalid prompt", false));

        VideoJob job = service.submit(request(null, null, null));

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error()).isEqualTo("422 invalid prompt");
    }

    @Test
    void rejectsUnsupportedOptions() {
        assertThatThrownBy(() -> service.submit(request("5:4", null, null)))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getReason()).isEqualTo("UNSUPPORTED_ASPECT_RATIO"));
        assertThatThrownBy(() -> service.submit(request(null, 7, null)))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getReason()).isEqualTo("UNSUPPORTED_DURATION"));
        assertThatThrownBy(() -> service.submit(request(null, null, "asap")))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getReason()).isEqualTo("INVALID_PRIORITY"));
        assertThat(queue.stats().total()).isZero();
    }

    @Test
    void missingApiKeyIsServiceUnavailable() {
        providerProps.setApiKey(" ");

        assertThatThrownBy(() -> service.submit(request(null, null, null)))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));
        verify(provider, never()).submit(any());
    }

    @Test
    void cancelledWhileSubmittingLeavesJobCancelled() {
        VideoJob job = queue.create("o", "r", JobPriority.NORMAL, Map.of("businessName", "Shop", "aspectRatio", "1:1"));
        when(provider.submit(any())).thenAnswer(inv -> {
            queue.cancel(job.id());
            return "late-handle";
        });

        assertThat(service.attempt(job)).isFalse();

        assertThat(queue.get(job.id())).map(VideoJob::status).contains(JobStatus.FAILED);
        assertThat(queue.findByProviderHandle("late-handle")).isEmpty();
    }
}
