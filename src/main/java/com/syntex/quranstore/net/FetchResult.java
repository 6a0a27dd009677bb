package com.syntex.quranstore.net;

import java.util.Objects;

/**
 * Either a fetched value or the {@link FetchFailure} that ended the attempt.
 * Callers branch on {@link #isSuccess()} instead of catching exceptions.
 */
public final class FetchResult<T> {

    private final T value;
    private final int attempts;
    private final FetchFailure failure;

    private FetchResult(T value, int attempts, FetchFailure failure) {
        this.value = value;
        this.attempts = attempts;
        this.failure = failure;
    }

    public static <T> FetchResult<T> success(T value, int attempts) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), attempts, null);
    }

    public static <T> FetchResult<T> failure(FetchFailure failure) {
        Objects.requireNonNull(failure, "failure");
        return new FetchResult<>(null, failure.attempts(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T value() {
        if (failure != null) {
            throw new IllegalStateException("No value on a failed fetch: " + failure);
        }
        return value;
    }

    public FetchFailure failure() {
        return failure;
    }

    public int attempts() {
        return attempts;
    }
}
