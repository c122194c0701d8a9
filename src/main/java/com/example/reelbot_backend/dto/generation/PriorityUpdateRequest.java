package com.example.reelbot_backend.dto.generation;

import jakarta.validation.constraints.NotBlank;

public record PriorityUpdateRequest(@NotBlank String priority) {}
