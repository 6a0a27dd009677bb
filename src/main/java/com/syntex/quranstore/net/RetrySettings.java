package com.syntex.quranstore.net;

/**
 * Bounded exponential backoff: retry {@code n} waits
 * {@code min(maxDelay, baseDelay * 2^(n-1))}, shortened by up to
 * {@code jitter} of itself.
 */
public record RetrySettings(int maxAttempts, long baseDelayMillis, long maxDelayMillis, double jitter) {

    public static final int DEFAULT_MAX_ATTEMPTS = 6;

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelayMillis < 0 || maxDelayMillis < baseDelayMillis) {
            throw new IllegalArgumentException("Invalid backoff window " + baseDelayMillis + ".." + maxDelayMillis);
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got " + jitter);
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(DEFAULT_MAX_ATTEMPTS, 500, 30_000, 0.5);
    }

    public RetrySettings withMaxAttempts(int attempts) {
        return new RetrySettings(attempts, baseDelayMillis, maxDelayMillis, jitter);
    }
}
