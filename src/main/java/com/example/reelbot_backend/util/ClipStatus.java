package com.example.reelbot_backend.util;

import java.util.EnumSet;
import java.util.Set;

public enum ClipStatus {
    PENDING,
    GENERATING_AUDIO,
    GENERATING_VIDEO,
    COMPLETED,
    FAILED;

    public static final Set<ClipStatus> IN_FLIGHT = EnumSet.of(GENERATING_AUDIO, GENERATING_VIDEO);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
