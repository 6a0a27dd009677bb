package com.syntex.quranstore.net;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.junit.jupiter.api.Test;
import org.springframework.retry.RetryContext;

class HttpRetryPolicyTest {

    private final HttpRetryPolicy policy = new HttpRetryPolicy(3);

    private RetryContext failedWith(Throwable failure, int times) {
        RetryContext context = policy.open(null);
        for (int i = 0; i < times; i++) {
            policy.registerThrowable(context, failure);
        }
        return context;
    }

    @Test
    void retriesRetryableKindsUntilAttemptsRunOut() {
        HttpStatusException unavailable = new HttpStatusException(503, FailureKind.SERVER_ERROR, "HTTP 503", null);

        assertThat(policy.canRetry(policy.open(null))).isTrue();
        assertThat(policy.canRetry(failedWith(unavailable, 2))).isTrue();
        assertThat(policy.canRetry(failedWith(unavailable, 3))).isFalse();
        assertThat(policy.canRetry(failedWith(new UncheckedIOException(new IOException("reset")), 1))).isTrue();
    }

    @Test
    void permanentFailureStopsImmediately() {
        HttpStatusException notFound = new HttpStatusException(404, FailureKind.PERMANENT, "HTTP 404", null);

        assertThat(policy.canRetry(failedWith(notFound, 1))).isFalse();
        assertThat(policy.canRetry(failedWith(new IllegalStateException("bug"), 1))).isFalse();
    }

    @Test
    void classificationFollowsFailureKinds() {
        assertThat(HttpRetryPolicy.classify(new UncheckedIOException(new IOException("x"))))
                .isEqualTo(FailureKind.TRANSPORT);
        assertThat(HttpRetryPolicy.classify(new NullPointerException())).isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureKind.RATE_LIMITED.isRetryable()).isTrue();
        assertThat(FailureKind.SERVER_ERROR.isRetryable()).isTrue();
        assertThat(FailureKind.TRANSPORT.isRetryable()).isTrue();
        assertThat(FailureKind.PERMANENT.isRetryable()).isFalse();
        assertThat(FailureKind.WRITE_CONSTRAINT_VIOLATION.isRetryable()).isFalse();
    }
}
