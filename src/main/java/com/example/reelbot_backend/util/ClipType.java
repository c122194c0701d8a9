package com.example.reelbot_backend.util;

/**
 * Role of a clip inside the composite: opening hook, testimonial body, closing call to action.
 */
public enum ClipType {
    HOOK,
    TESTIMONIAL,
    CTA
}
