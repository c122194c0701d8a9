package com.example.reelbot_backend.util;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of remote provider states. Wire strings are translated through an explicit table so
 * that a state the provider introduces later fails loudly instead of defaulting to something.
 */
public enum ProviderState {
    IN_QUEUE,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    private static final Map<String, ProviderState> WIRE = Map.ofEntries(
            Map.entry("in_queue", IN_QUEUE),
            Map.entry("queued", IN_QUEUE),
            Map.entry("in_progress", IN_PROGRESS),
            Map.entry("running", IN_PROGRESS),
            Map.entry("processing", IN_PROGRESS),
            Map.entry("completed", COMPLETED),
            Map.entry("succeeded", COMPLETED),
            Map.entry("ok", COMPLETED),
            Map.entry("failed", FAILED),
            Map.entry("errored", FAILED),
            Map.entry("error", FAILED)
    );

    public static ProviderState fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownProviderStateException(raw);
        }
        ProviderState state = WIRE.get(raw.trim().toLowerCase(Locale.ROOT));
        if (state == null) {
            throw new UnknownProviderStateException(raw);
        }
        return state;
    }
}
