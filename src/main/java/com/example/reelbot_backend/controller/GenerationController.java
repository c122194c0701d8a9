package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.dto.generation.JobView;
import com.example.reelbot_backend.dto.generation.PriorityUpdateRequest;
import com.example.reelbot_backend.dto.generation.SubmitGenerationRequest;
import com.example.reelbot_backend.dto.generation.SubmitGenerationResponse;
import com.example.reelbot_backend.dto.progress.ProgressSnapshot;
import com.example.reelbot_backend.service.ProgressBroadcaster;
import com.example.reelbot_backend.service.SubmissionService;
import com.example.reelbot_backend.service.queue.JobQueue;
import com.example.reelbot_backend.service.queue.QueueStats;
import com.example.reelbot_backend.service.queue.VideoJob;
import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Single-stage generation jobs: submission, progress and queue management.
 */
@RestController
@RequestMapping("/v1/generations")
public class GenerationController {
    private final SubmissionService submissions;
    private final JobQueue queue;
    private final ProgressBroadcaster broadcaster;

    public GenerationController(SubmissionService submissions, JobQueue queue, ProgressBroadcaster broadcaster) {
        this.submissions = submissions;
        this.queue = queue;
        this.broadcaster = broadcaster;
    }

    @Operation(summary = "Submit a testimonial video generation job")
    @ApiResponse(responseCode = "202", description = "Job accepted; poll or stream for progress")
    @ApiResponse(responseCode = "400", description = "Invalid request payload")
    @ApiResponse(responseCode = "502", description = "Provider rejected the job")
    @PostMapping
    public ResponseEntity<SubmitGenerationResponse> submit(@Valid @RequestBody SubmitGenerationRequest request) {
        VideoJob job = submissions.submit(request);
        HttpStatus status = job.status() == JobStatus.FAILED ? HttpStatus.BAD_GATEWAY : HttpStatus.ACCEPTED;
        String message = switch (job.status()) {
            case PROCESSING -> "Video generation started. Poll /v1/generations/" + job.id() + " for updates.";
            case PENDING -> "Provider unavailable, submission will be retried.";
            case FAILED -> job.error();
            case COMPLETED -> "Video generation completed.";
        };
        return ResponseEntity.status(status).body(new SubmitGenerationResponse(job.id(),
                job.status().name().toLowerCase(), job.providerHandle(), message));
    }

    @Operation(summary = "Current progress of a job, synced with the provider first")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @GetMapping("/{id}")
    public ProgressSnapshot get(@PathVariable String id) {
        return broadcaster.jobSnapshot(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Server-sent progress events until the job finishes")
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressSnapshot>> stream(@PathVariable String id) {
        return broadcaster.streamJob(id);
    }

    @Operation(summary = "Cancel a pending or processing job")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @DeleteMapping("/{id}")
    public JobView cancel(@PathVariable String id) {
        return queue.cancel(id).map(JobView::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Manually retry a failed job")
    @ApiResponse(responseCode = "409", description = "Job is not failed or its retry budget is used up")
    @PostMapping("/{id}/retry")
    public JobView retry(@PathVariable String id) {
        return queue.retry(id).map(JobView::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Change the priority of an unfinished job")
    @ApiResponse(responseCode = "409", description = "Job already finished")
    @PatchMapping("/{id}/priority")
    public JobView priority(@PathVariable String id, @Valid @RequestBody PriorityUpdateRequest request) {
        JobPriority priority;
        try {
            priority = JobPriority.parseOrDefault(request.priority(), JobPriority.NORMAL);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PRIORITY");
        }
        return queue.setPriority(id, priority).map(JobView::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Jobs of an owner, or all jobs generated for one review")
    @ApiResponse(responseCode = "400", description = "Neither ownerId nor reviewId given")
    @GetMapping
    public List<JobView> list(@RequestParam(required = false) String ownerId,
                              @RequestParam(required = false) String reviewId) {
        List<VideoJob> jobs;
        if (reviewId != null && !reviewId.isBlank()) {
            jobs = queue.listByCorrelation(reviewId);
        } else if (ownerId != null && !ownerId.isBlank()) {
            jobs = queue.listByOwner(ownerId);
        } else {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "OWNER_OR_REVIEW_REQUIRED");
        }
        return jobs.stream().map(JobView::of).toList();
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return queue.stats();
    }
}
