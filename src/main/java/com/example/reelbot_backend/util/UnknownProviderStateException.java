package com.example.reelbot_backend.util;

public class UnknownProviderStateException extends IllegalArgumentException {
    private final String rawState;

    public UnknownProviderStateException(String rawState) {
        super("Unknown provider state: " + rawState);
        this.rawState = rawState;
    }

    public String getRawState() {
        return rawState;
    }
}
