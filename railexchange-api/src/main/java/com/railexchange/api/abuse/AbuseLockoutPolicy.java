package com.railexchange.api.abuse;

import com.railexchange.core.domain.AbuseSignals;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lockout rules driven by moderation signals.
 *
 * Reports: three rejected (false) reports lock reporting for 48 hours from the last rejection;
 * each further rejection doubles the lockout, up to 30 days. A moderator can also set an
 * explicit lockout end. Accounts younger than 24 hours cannot report at all.
 *
 * Inquiries: three spam flags lock sending for 24 hours from the last flag, escalating the
 * same way. The daily inquiry allowance depends on email verification and account age.
 *
 * When a threshold is met but the time of the triggering event is unknown, the full lockout
 * is applied from now.
 */
@Component
public class AbuseLockoutPolicy {

    public static final int FALSE_REPORT_THRESHOLD = 3;
    public static final Duration REPORT_LOCKOUT = Duration.ofHours(48);
    public static final Duration MIN_REPORTER_ACCOUNT_AGE = Duration.ofHours(24);

    public static final int SPAM_FLAG_THRESHOLD = 3;
    public static final Duration SPAM_LOCKOUT = Duration.ofHours(24);

    public static final Duration MAX_LOCKOUT = Duration.ofDays(30);

    public static final Duration NEW_ACCOUNT_AGE = Duration.ofDays(7);
    public static final int NEW_ACCOUNT_DAILY_INQUIRIES = 5;
    public static final int ESTABLISHED_DAILY_INQUIRIES = 20;

    static final String REPORT_LOCKED_BY_MODERATOR =
            "You are temporarily unable to submit reports. Please try again later.";
    static final String REPORT_LOCKED = "Report submission is temporarily unavailable.";
    static final String REPORTER_TOO_NEW = "Report submission is temporarily unavailable.";
    static final String INQUIRIES_LOCKED = "Inquiries are temporarily unavailable. Please try again later.";

    /**
     * Active report lockout, if any.
     */
    public Optional<Lockout> reportLockout(AbuseSignals signals, Instant now) {
        if (signals.reportRateLimitedUntil() != null && signals.reportRateLimitedUntil().isAfter(now)) {
            return Optional.of(new Lockout(signals.reportRateLimitedUntil(), REPORT_LOCKED_BY_MODERATOR));
        }
        if (signals.rejectedReportCount() < FALSE_REPORT_THRESHOLD) {
            return Optional.empty();
        }
        Duration length = escalate(REPORT_LOCKOUT, signals.rejectedReportCount() - FALSE_REPORT_THRESHOLD);
        Instant from = signals.lastRejectedReportAt() != null ? signals.lastRejectedReportAt() : now;
        Instant until = from.plus(length);
        return until.isAfter(now) ? Optional.of(new Lockout(until, REPORT_LOCKED)) : Optional.empty();
    }

    /**
     * End of the lockout a moderator should record after one more report is rejected.
     * Empty while the account stays below the threshold.
     */
    public Optional<Instant> nextReportLockoutUntil(int rejectedReportCountAfter, Instant rejectedAt) {
        if (rejectedReportCountAfter < FALSE_REPORT_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(rejectedAt.plus(
                escalate(REPORT_LOCKOUT, rejectedReportCountAfter - FALSE_REPORT_THRESHOLD)));
    }

    /**
     * Accounts must exist for a while before they can report. Unknown creation time counts as new.
     */
    public Optional<Lockout> reporterAgeLockout(Instant accountCreatedAt, Instant now) {
        Instant from = accountCreatedAt != null ? accountCreatedAt : now;
        Instant eligibleAt = from.plus(MIN_REPORTER_ACCOUNT_AGE);
        return eligibleAt.isAfter(now) ? Optional.of(new Lockout(eligibleAt, REPORTER_TOO_NEW)) : Optional.empty();
    }

    /**
     * Active inquiry lockout from spam flags, if any.
     */
    public Optional<Lockout> spamLockout(AbuseSignals signals, Instant now) {
        if (signals.spamFlagCount() < SPAM_FLAG_THRESHOLD) {
            return Optional.empty();
        }
        Duration length = escalate(SPAM_LOCKOUT, signals.spamFlagCount() - SPAM_FLAG_THRESHOLD);
        Instant from = signals.lastSpamFlagAt() != null ? signals.lastSpamFlagAt() : now;
        Instant until = from.plus(length);
        return until.isAfter(now) ? Optional.of(new Lockout(until, INQUIRIES_LOCKED)) : Optional.empty();
    }

    /**
     * Inquiries allowed per day: none without a verified email, fewer for new accounts.
     */
    public int dailyInquiryAllowance(boolean emailVerified, Instant accountCreatedAt, Instant now) {
        if (!emailVerified) {
            return 0;
        }
        if (accountCreatedAt == null || accountCreatedAt.plus(NEW_ACCOUNT_AGE).isAfter(now)) {
            return NEW_ACCOUNT_DAILY_INQUIRIES;
        }
        return ESTABLISHED_DAILY_INQUIRIES;
    }

    /**
     * Doubles {@code base} once per step beyond the threshold, capped at 30 days.
     */
    static Duration escalate(Duration base, int stepsBeyondThreshold) {
        Duration length = base;
        for (int i = 0; i < stepsBeyondThreshold; i++) {
            length = length.multipliedBy(2);
            if (length.compareTo(MAX_LOCKOUT) >= 0) {
                return MAX_LOCKOUT;
            }
        }
        return length;
    }

    public record Lockout(Instant until, String message) {

        public long retryAfterSeconds(Instant now) {
            long seconds = Duration.between(now, until).toSeconds();
            return Math.max(1, seconds);
        }
    }
}
