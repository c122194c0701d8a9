package com.example.reelbot_backend.util;

import java.util.Locale;

/**
 * Queue priority. Higher weight runs first.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public static JobPriority parseOrDefault(String raw, JobPriority fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return JobPriority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
