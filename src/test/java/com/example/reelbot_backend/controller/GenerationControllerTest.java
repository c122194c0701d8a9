package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.dto.progress.ProgressSnapshot;
import com.example.reelbot_backend.service.ProgressBroadcaster;
import com.example.reelbot_backend.service.SubmissionService;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.service.queue.QueueStats;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = GenerationController.class)
@AutoConfigureMockMvc(addFilters = false)
class GenerationControllerTest {

    private static final String BODY = """
            {"reviewText":"Great coffee","reviewerName":"Ana","businessName":"Bean There","style":"warm"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubmissionService submissionService;

    @MockitoBean
    private JobQueue jobQueue;

    @MockitoBean
    private ProgressBroadcaster progressBroadcaster;

    private static VideoJob job(JobStatus status, String handle, String error) {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        return new VideoJob("job_abc", "anonymous", "review_1", status, JobPriority.NORMAL, 5, handle, null, error,
                0, 3, now, now, null, null, Map.of(), 1L);
    }

    @Test
    void submitReturnsAccepted() throws Exception {
        when(submissionService.submit(any())).thenReturn(job(JobStatus.PROCESSING, "req-1", null));

        mockMvc.perform(post("/v1/generations").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job_abc"))
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.providerHandle").value("req-1"));
    }

    @Test
    void submitReportsBadGatewayWhenProviderRejected() throws Exception {
        when(submissionService.submit(any())).thenReturn(job(JobStatus.FAILED, null, "422 invalid prompt"));

        mockMvc.perform(post("/v1/generations").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("422 invalid prompt"));
    }

    @Test
    void submitValidatesRequiredFields() throws Exception {
        mockMvc.perform(post("/v1/generations").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewerName\":\"Ana\",\"businessName\":\"B\",\"style\":\"warm\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("REVIEW_TEXT_REQUIRED"));

        verify(submissionService, never()).submit(any());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(progressBroadcaster.jobSnapshot("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/generations/nope")).andExpect(status().isNotFound());
    }

    @Test
    void snapshotIsReturned() throws Exception {
        when(progressBroadcaster.jobSnapshot("job_abc")).thenReturn(Optional.of(new ProgressSnapshot("job_abc", "video",
                0, 50, 20, "generating", null, null, null, null, null, null, null, "normal", 0, null, null, null)));

        mockMvc.perform(get("/v1/generations/job_abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallProgress").value(50))
                .andExpect(jsonPath("$.clips").doesNotExist());
    }

    @Test
    void retryOfNonFailedJobIsConflict() throws Exception {
        when(jobQueue.retry("job_abc")).thenThrow(new IllegalStateException("Job job_abc is PROCESSING"));

        mockMvc.perform(post("/v1/generations/job_abc/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"));
    }

    @Test
    void invalidPriorityIsBadRequest() throws Exception {
        mockMvc.perform(patch("/v1/generations/job_abc/priority").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\":\"asap\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statsAreExposed() throws Exception {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        byStatus.put(JobStatus.PENDING, 2L);
        when(jobQueue.stats()).thenReturn(new QueueStats(2, byStatus, new EnumMap<>(JobPriority.class)));

        mockMvc.perform(get("/v1/generations/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.byStatus.PENDING").value(2));
    }
}
