package com.example.reelbot_backend.engine;

/**
 * Failure talking to the generation provider. Retryable failures (throttling, gateway errors,
 * network trouble) may succeed on a later attempt; the others will not.
 */
public class ProviderException extends RuntimeException {
    private final boolean retryable;

    public ProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
