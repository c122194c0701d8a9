package com.example.reelbot_backend.service;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether an error message reported by the provider describes a transient condition.
 */
public final class ProviderErrorClassifier {
    private static final List<String> RETRYABLE_MARKERS = List.of(
            "rate limit",
            "timeout",
            "timed out",
            "network error",
            "temporarily unavailable",
            "429",
            "502",
            "503"
    );

    private ProviderErrorClassifier() {}

    public static boolean isRetryable(String error) {
        if (error == null || error.isBlank()) {
            return false;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        return RETRYABLE_MARKERS.stream().anyMatch(lower::contains);
    }
}
