package com.example.reelbot_backend.util;

/**
 * Tracks lifecycle of a persisted multi-clip composite video.
 */
public enum CompositeStatus {
    PENDING,
    GENERATING_CLIPS,
    STITCHING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
