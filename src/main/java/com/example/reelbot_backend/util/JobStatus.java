package com.example.reelbot_backend.util;

/**
 * Lifecycle of a single-stage generation job held in the in-memory queue.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
