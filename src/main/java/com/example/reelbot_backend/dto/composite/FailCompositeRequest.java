package com.example.reelbot_backend.dto.composite;

public record FailCompositeRequest(String reason) {}
