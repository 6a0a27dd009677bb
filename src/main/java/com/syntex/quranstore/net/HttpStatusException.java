package com.syntex.quranstore.net;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * A non-2xx response, raised inside a retry attempt so the retry policy can
 * classify it.
 */
public class HttpStatusException extends RuntimeException {

    private final int status;
    private final FailureKind kind;
    private final Long retryAfterMillis;

    public HttpStatusException(int status, FailureKind kind, String message, Long retryAfterMillis) {
        super(message);
        this.status = status;
        this.kind = kind;
        this.retryAfterMillis = retryAfterMillis;
    }

    static HttpStatusException from(RawResponse response, String url) {
        int status = response.status();
        FailureKind kind;
        if (status == 429) {
            kind = FailureKind.RATE_LIMITED;
        } else if (status >= 500) {
            kind = FailureKind.SERVER_ERROR;
        } else {
            kind = FailureKind.PERMANENT;
        }
        Long retryAfter = status == 429 ? parseRetryAfter(response.header("Retry-After")) : null;
        return new HttpStatusException(status, kind, "HTTP " + status + " from " + url, retryAfter);
    }

    /**
     * Retry-After is either delta seconds or an HTTP date. Returns millis
     * (saturating at {@code Long.MAX_VALUE}), or null when the header is
     * absent or unreadable.
     */
    static Long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            if (seconds <= 0) {
                return 0L;
            }
            return seconds >= Long.MAX_VALUE / 1000 ? Long.MAX_VALUE : seconds * 1000L;
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                return Math.max(0, Duration.between(ZonedDateTime.now(at.getZone()), at).toMillis());
            } catch (DateTimeParseException | ArithmeticException e) {
                return null;
            }
        }
    }

    public int getStatus() {
        return status;
    }

    public FailureKind getKind() {
        return kind;
    }

    public Long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
