package com.railexchange.api.abuse;

import com.railexchange.api.abuse.AbuseLockoutPolicy.Lockout;
import com.railexchange.api.abuse.ContentFilter.ContentCheck;
import com.railexchange.api.ratelimit.RateIdentity;
import com.railexchange.api.ratelimit.RateLimitAction;
import com.railexchange.api.ratelimit.RateLimitOutcome;
import com.railexchange.api.ratelimit.RateLimitResult;
import com.railexchange.api.ratelimit.RateLimiterService;
import com.railexchange.core.domain.AbuseSignals;
import com.railexchange.core.domain.EntitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Abuse checks for inquiries and reports, layered on top of the per-action rate limits.
 *
 * Checks run cheapest and most specific first. Content and lockout rejections happen before
 * any counter is incremented.
 */
@Service
public class AbusePreventionService {

    private static final Logger log = LoggerFactory.getLogger(AbusePreventionService.class);

    static final String DAILY_INQUIRY_SCOPE = "inquiry-daily";
    static final Duration DAILY_WINDOW = Duration.ofDays(1);
    static final String EMAIL_NOT_VERIFIED = "Please verify your email address to send inquiries.";
    static final String ACCOUNT_REQUIRED = "Please sign in to continue.";

    private final ContentFilter contentFilter;
    private final AbuseLockoutPolicy lockoutPolicy;
    private final RateLimiterService rateLimiter;
    private final Clock clock;

    public AbusePreventionService(ContentFilter contentFilter,
                                  AbuseLockoutPolicy lockoutPolicy,
                                  RateLimiterService rateLimiter,
                                  Clock clock) {
        this.contentFilter = contentFilter;
        this.lockoutPolicy = lockoutPolicy;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * Checks whether {@code sender} may send an inquiry with the given body.
     * Order: content filter, spam lockout, hourly inquiry limit, daily allowance.
     */
    public RateLimitResult checkInquiry(RateIdentity identity, boolean isVerified, EntitySnapshot sender, String body) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (sender == null) {
            return denied(ACCOUNT_REQUIRED);
        }
        Instant now = clock.instant();

        ContentCheck content = contentFilter.check(body);
        if (!content.allowed()) {
            log.info("Inquiry from {} rejected by content filter (phrase: {})", sender.id(), content.matchedPhrase());
            return RateLimitResult.contentRejected(content.reason());
        }

        AbuseSignals signals = sender.abuseSignals();
        Optional<Lockout> spamLockout = lockoutPolicy.spamLockout(signals, now);
        if (spamLockout.isPresent()) {
            return RateLimitResult.lockedOut(spamLockout.get().retryAfterSeconds(now), spamLockout.get().message());
        }

        int allowance = lockoutPolicy.dailyInquiryAllowance(sender.emailVerified(), sender.createdAt(), now);
        if (allowance == 0) {
            return denied(EMAIL_NOT_VERIFIED);
        }

        // a request the hourly window rejects must not spend a daily slot
        RateLimitResult hourly = rateLimiter.checkLimit(RateLimitAction.INQUIRY, identity, isVerified);
        if (!hourly.allowed()) {
            return hourly;
        }
        RateLimitResult daily = rateLimiter.checkWindow(DAILY_INQUIRY_SCOPE, identity, allowance, DAILY_WINDOW);
        if (!daily.allowed()) {
            return daily;
        }
        return hourly;
    }

    /**
     * Checks whether {@code reporter} may file a report.
     * Order: report lockout, minimum account age, hourly report limit.
     */
    public RateLimitResult checkReport(RateIdentity identity, boolean isVerified, EntitySnapshot reporter) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (reporter == null) {
            return denied(ACCOUNT_REQUIRED);
        }
        Instant now = clock.instant();

        Optional<Lockout> lockout = lockoutPolicy.reportLockout(reporter.abuseSignals(), now);
        if (lockout.isEmpty()) {
            lockout = lockoutPolicy.reporterAgeLockout(reporter.createdAt(), now);
        }
        if (lockout.isPresent()) {
            return RateLimitResult.lockedOut(lockout.get().retryAfterSeconds(now), lockout.get().message());
        }

        return rateLimiter.checkLimit(RateLimitAction.REPORT, identity, isVerified);
    }

    /**
     * Validates an inquiry body on its own, without counting. Returns null when acceptable.
     */
    public String validateInquiryContent(String body) {
        ContentCheck content = contentFilter.check(body);
        return content.allowed() ? null : content.reason();
    }

    private static RateLimitResult denied(String message) {
        return new RateLimitResult(false, 0, null, RateLimitOutcome.LOCKED_OUT, message);
    }
}
