package com.syntex.quranstore.net;

/**
 * Terminal outcome categories for a unit of work. Only the first three are
 * retryable, and only inside {@link RetryClient}.
 */
public enum FailureKind {
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    TRANSPORT(true),
    PERMANENT(false),
    WRITE_CONSTRAINT_VIOLATION(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
