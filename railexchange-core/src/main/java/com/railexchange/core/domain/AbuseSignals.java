package com.railexchange.core.domain;

import java.time.Instant;

/**
 * Per-account abuse counters written by moderation actions.
 * Read-only to the rate limiter.
 *
 * @param rejectedReportCount    reports filed by the account that moderation rejected as false
 * @param spamFlagCount          inquiries from the account flagged as spam
 * @param reportRateLimitedUntil explicit report lockout set by a moderator, if any
 * @param lastRejectedReportAt   when the most recent report was rejected
 * @param lastSpamFlagAt         when the most recent spam flag was raised
 */
public record AbuseSignals(
        int rejectedReportCount,
        int spamFlagCount,
        Instant reportRateLimitedUntil,
        Instant lastRejectedReportAt,
        Instant lastSpamFlagAt
) {

    public AbuseSignals {
        if (rejectedReportCount < 0) {
            throw new IllegalArgumentException("rejectedReportCount cannot be negative");
        }
        if (spamFlagCount < 0) {
            throw new IllegalArgumentException("spamFlagCount cannot be negative");
        }
    }

    public static AbuseSignals clean() {
        return new AbuseSignals(0, 0, null, null, null);
    }
}
