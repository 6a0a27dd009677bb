package com.syntex.quranstore.net;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LongSummaryStatistics;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class JitteredBackOffPolicyTest {

    private static JitteredBackOffPolicy policy(RetrySettings settings) {
        return new JitteredBackOffPolicy(settings, millis -> { });
    }

    @Test
    void backoffGrowsAndNeverExceedsCap() {
        JitteredBackOffPolicy backOff = policy(new RetrySettings(12, 100, 1_500, 0.5));

        for (int retry = 1; retry <= 12; retry++) {
            long capped = Math.min(1_500, 100L << (retry - 1));
            assertThat(backOff.backoffDelay(retry)).isBetween(capped / 2, capped);
        }
    }

    @Test
    void jitterStillSpreadsDelaysOnceTheCapIsReached() {
        JitteredBackOffPolicy backOff = policy(new RetrySettings(20, 100, 1_000, 0.5));

        LongSummaryStatistics delays = IntStream.range(0, 200)
                .mapToLong(i -> backOff.backoffDelay(15))
                .summaryStatistics();

        assertThat(delays.getMax()).isLessThanOrEqualTo(1_000);
        assertThat(delays.getMin()).isGreaterThanOrEqualTo(500);
        assertThat(delays.getMin()).isLessThan(delays.getMax());
    }

    @Test
    void retryAfterReplacesBackoffWithinBounds() {
        JitteredBackOffPolicy backOff = policy(new RetrySettings(5, 100, 5_000, 0.0));

        assertThat(backOff.nextDelay(1, new HttpStatusException(429, FailureKind.RATE_LIMITED, "HTTP 429", 3_000L)))
                .isEqualTo(3_000);
        assertThat(backOff.nextDelay(1, new HttpStatusException(429, FailureKind.RATE_LIMITED, "HTTP 429",
                Long.MAX_VALUE))).isEqualTo(5_000);
        assertThat(backOff.nextDelay(1, new HttpStatusException(429, FailureKind.RATE_LIMITED, "HTTP 429", -5L)))
                .isZero();
        assertThat(backOff.nextDelay(3, new HttpStatusException(503, FailureKind.SERVER_ERROR, "HTTP 503", null)))
                .isEqualTo(400);
    }

    @Test
    void parsesRetryAfterForms() {
        assertThat(HttpStatusException.parseRetryAfter("7")).isEqualTo(7000L);
        assertThat(HttpStatusException.parseRetryAfter(" 0 ")).isZero();
        assertThat(HttpStatusException.parseRetryAfter("-3")).isZero();
        assertThat(HttpStatusException.parseRetryAfter("9300000000000000")).isEqualTo(Long.MAX_VALUE);
        assertThat(HttpStatusException.parseRetryAfter("99999999999999999999999")).isNull();
        assertThat(HttpStatusException.parseRetryAfter(null)).isNull();
        assertThat(HttpStatusException.parseRetryAfter("soon")).isNull();

        String past = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).minusHours(1));
        assertThat(HttpStatusException.parseRetryAfter(past)).isZero();

        String future = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).plusMinutes(2));
        assertThat(HttpStatusException.parseRetryAfter(future)).isBetween(60_000L, 120_000L);
    }

    @Test
    void settingsRejectNonsenseWindows() {
        assertThatThrownBy(() -> new RetrySettings(0, 100, 1000, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrySettings(3, 2000, 1000, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrySettings(3, 100, 1000, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrySettings(3, 100, 1000, 1.5)).isInstanceOf(IllegalArgumentException.class);

        RetrySettings two = RetrySettings.defaults().withMaxAttempts(2);
        assertThat(two.maxAttempts()).isEqualTo(2);
        assertThat(two.maxDelayMillis()).isEqualTo(30_000);
    }
}
