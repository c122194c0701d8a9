package com.example.reelbot_backend.dto.generation;

public record SubmitGenerationResponse(String jobId, String status, String providerHandle, String message) {}
