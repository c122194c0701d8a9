package com.example.reelbot_backend.service.pipeline;

import com.example.reelbot_backend.util.ClipType;

/**
 * One spoken line of a composite. {@code order} is 1-based and becomes the clip index.
 */
public record ScriptSegment(ClipType type, String content, double estimatedDuration, int order) {}
