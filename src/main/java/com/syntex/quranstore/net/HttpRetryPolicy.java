package com.syntex.quranstore.net;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries an attempt while its failure is {@link FailureKind#isRetryable()
 * retryable} and attempts remain. A PERMANENT failure stops on the spot.
 */
class HttpRetryPolicy extends SimpleRetryPolicy {

    HttpRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        return last == null || (classify(last).isRetryable() && context.getRetryCount() < getMaxAttempts());
    }

    static FailureKind classify(Throwable failure) {
        if (failure instanceof HttpStatusException) {
            return ((HttpStatusException) failure).getKind();
        }
        if (failure instanceof UncheckedIOException || failure instanceof IOException) {
            return FailureKind.TRANSPORT;
        }
        return FailureKind.PERMANENT;
    }
}
