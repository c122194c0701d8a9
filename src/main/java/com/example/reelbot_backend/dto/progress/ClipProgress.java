package com.example.reelbot_backend.dto.progress;

public record ClipProgress(int index, String type, String status, int progress, String videoUrl, String error) {}
