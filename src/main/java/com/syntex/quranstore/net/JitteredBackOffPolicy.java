package com.syntex.quranstore.net;

import java.util.concurrent.ThreadLocalRandom;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Exponential backoff with jitter applied below the cap, so fetchers that hit
 * the cap together still spread out. A 429's Retry-After replaces the computed
 * delay. Every delay is clamped to [0, maxDelay].
 */
class JitteredBackOffPolicy implements BackOffPolicy {

    private final RetrySettings settings;
    private final Sleeper sleeper;

    JitteredBackOffPolicy(RetrySettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    private static final class Backoffs implements BackOffContext {
        private final transient RetryContext retryContext;
        private int taken;

        private Backoffs(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new Backoffs(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        Backoffs ctx = (Backoffs) backOffContext;
        Throwable last = ctx.retryContext.getLastThrowable();
        long delay = nextDelay(++ctx.taken, last);
        System.err.println("⚠ " + (last != null ? last.getMessage() : "attempt failed")
                + " (attempt " + ctx.retryContext.getRetryCount() + "/" + settings.maxAttempts()
                + "), retrying in " + delay + "ms");
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    long nextDelay(int retry, Throwable last) {
        Long retryAfter = last instanceof HttpStatusException
                ? ((HttpStatusException) last).getRetryAfterMillis()
                : null;
        long delay = retryAfter != null ? retryAfter : backoffDelay(retry);
        return Math.max(0, Math.min(settings.maxDelayMillis(), delay));
    }

    long backoffDelay(int retry) {
        double exponential = settings.baseDelayMillis() * Math.pow(2, retry - 1);
        double capped = Math.min(settings.maxDelayMillis(), exponential);
        return (long) (capped * (1 - settings.jitter() * ThreadLocalRandom.current().nextDouble()));
    }
}
