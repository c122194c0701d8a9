package com.example.reelbot_backend.service.pipeline;

import java.util.List;

public record SegmentationResult(List<ScriptSegment> segments, double totalDuration, int clipCount) {

    public SegmentationResult {
        segments = List.copyOf(segments);
    }

    public record Validation(boolean valid, List<String> errors) {}
}
