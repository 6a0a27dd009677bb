package com.syntex.quranstore.net;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Wraps an {@link HttpTransport} in a {@link RetryTemplate} that retries 429,
 * 5xx and transport errors. Owns every retry decision: callers only ever see
 * the final {@link FetchResult}.
 * <p>
 * Instances are safe to share between fetcher threads. Each call backs off on
 * its own thread, so one slow unit never stalls another.
 */
public class RetryClient {

    private final HttpTransport transport;
    private final RetrySettings settings;
    private final RetryTemplate retryTemplate;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();

    public RetryClient(HttpTransport transport, RetrySettings settings) {
        this(transport, settings, new ThreadWaitSleeper());
    }

    public RetryClient(HttpTransport transport, RetrySettings settings, Sleeper sleeper) {
        this.transport = transport;
        this.settings = settings;
        this.retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new HttpRetryPolicy(settings.maxAttempts()));
        retryTemplate.setBackOffPolicy(new JitteredBackOffPolicy(settings, sleeper));
    }

    public FetchResult<byte[]> fetch(FetchRequest request) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retryTemplate.execute(context -> {
                attempts.incrementAndGet();
                requests.incrementAndGet();
                RawResponse response;
                try {
                    response = transport.execute(request);
                } catch (IOException e) {
                    throw new UncheckedIOException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
                }
                if (response.isSuccessful()) {
                    return FetchResult.success(response.body(), attempts.get());
                }
                if (response.status() == 429) {
                    rateLimited.incrementAndGet();
                }
                throw HttpStatusException.from(response, request.url());
            }, context -> exhausted(context.getLastThrowable(), attempts.get()));
        } catch (BackOffInterruptedException e) {
            return FetchResult.failure(new FetchFailure(FailureKind.TRANSPORT, attempts.get(),
                    "Interrupted while backing off from " + request.url()));
        } finally {
            retries.addAndGet(Math.max(0, attempts.get() - 1));
        }
    }

    private static FetchResult<byte[]> exhausted(Throwable last, int attempts) {
        if (last == null) {
            return FetchResult.failure(new FetchFailure(FailureKind.TRANSPORT, attempts, "no attempt made"));
        }
        String error = last instanceof HttpStatusException || last instanceof UncheckedIOException
                ? last.getMessage()
                : last.toString();
        return FetchResult.failure(new FetchFailure(HttpRetryPolicy.classify(last), attempts, error));
    }

    public RetrySettings getSettings() {
        return settings;
    }

    public long getRequestCount() {
        return requests.get();
    }

    public long getRetryCount() {
        return retries.get();
    }

    public long getRateLimitedCount() {
        return rateLimited.get();
    }
}
