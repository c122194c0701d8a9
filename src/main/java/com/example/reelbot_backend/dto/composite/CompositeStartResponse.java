package com.example.reelbot_backend.dto.composite;

import java.util.UUID;

public record CompositeStartResponse(UUID compositeVideoId, String status, int totalClips, int estimatedTime) {}
