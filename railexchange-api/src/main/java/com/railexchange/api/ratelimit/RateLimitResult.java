package com.railexchange.api.ratelimit;

/**
 * Result of a rate-limit or abuse check.
 *
 * @param retryAfterSeconds seconds until the caller may retry; null when allowed or not applicable
 * @param message           user-facing text, deliberately non-alarmist
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        Long retryAfterSeconds,
        RateLimitOutcome outcome,
        String message
) {

    public static final String LIMITED_MESSAGE = "Action temporarily unavailable. Please try again later.";
    static final long ERROR_RETRY_AFTER_SECONDS = 60;

    public static RateLimitResult allowed(int remaining) {
        return new RateLimitResult(true, remaining, null, RateLimitOutcome.ALLOWED, null);
    }

    public static RateLimitResult limited(long retryAfterSeconds) {
        return new RateLimitResult(false, 0, retryAfterSeconds, RateLimitOutcome.LIMITED, LIMITED_MESSAGE);
    }

    public static RateLimitResult lockedOut(long retryAfterSeconds, String message) {
        return new RateLimitResult(false, 0, retryAfterSeconds, RateLimitOutcome.LOCKED_OUT, message);
    }

    public static RateLimitResult contentRejected(String message) {
        return new RateLimitResult(false, 0, null, RateLimitOutcome.CONTENT_REJECTED, message);
    }

    public static RateLimitResult error() {
        return new RateLimitResult(false, 0, ERROR_RETRY_AFTER_SECONDS, RateLimitOutcome.ERROR, LIMITED_MESSAGE);
    }
}
