package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.dto.composite.CompositeStartRequest;
import com.example.reelbot_backend.dto.composite.CompositeStartResponse;
import com.example.reelbot_backend.dto.composite.FailCompositeRequest;
import com.example.reelbot_backend.dto.progress.ProgressSnapshot;
import com.example.reelbot_backend.service.PipelineCoordinator;
import com.example.reelbot_backend.service.ProgressBroadcaster;
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
import java.util.UUID;

@RestController
@RequestMapping("/v1/composites")
public class CompositeController {
    private final PipelineCoordinator coordinator;
    private final ProgressBroadcaster broadcaster;

    public CompositeController(PipelineCoordinator coordinator, ProgressBroadcaster broadcaster) {
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
    }

    @Operation(summary = "Start a multi-clip composite video")
    @ApiResponse(responseCode = "202", description = "Composite created, clips are generated in the background")
    @ApiResponse(responseCode = "400", description = "Missing script, unknown actor, unsupported voice or aspect ratio")
    @PostMapping
    public ResponseEntity<CompositeStartResponse> start(@Valid @RequestBody CompositeStartRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.start(request));
    }

    @Operation(summary = "Composite progress including per-clip status")
    @GetMapping("/{id}")
    public ProgressSnapshot get(@PathVariable UUID id) {
        return broadcaster.compositeSnapshot(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "COMPOSITE_NOT_FOUND"));
    }

    @GetMapping
    public List<ProgressSnapshot> byOwner(@RequestParam String ownerId) {
        return broadcaster.compositesForOwner(ownerId);
    }

    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressSnapshot>> stream(@PathVariable UUID id) {
        return broadcaster.streamComposite(id);
    }

    @Operation(summary = "Send a failed clip back to generation")
    @ApiResponse(responseCode = "409", description = "Clip is not failed or the composite is finished")
    @PostMapping("/{id}/clips/{index}/retry")
    public ResponseEntity<Void> retryClip(@PathVariable UUID id, @PathVariable int index) {
        coordinator.retryClip(id, index);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Fail an unfinished composite")
    @PostMapping("/{id}/fail")
    public ResponseEntity<Void> fail(@PathVariable UUID id, @RequestBody(required = false) FailCompositeRequest request) {
        coordinator.fail(id, request == null ? null : request.reason());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        coordinator.delete(id);
        return ResponseEntity.noContent().build();
    }
}
