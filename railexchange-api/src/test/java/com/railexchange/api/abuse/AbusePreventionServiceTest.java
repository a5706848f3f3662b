package com.railexchange.api.abuse;

import com.railexchange.api.config.RateLimitProperties;
import com.railexchange.api.ratelimit.LocalRateLimitStore;
import com.railexchange.api.ratelimit.RateIdentity;
import com.railexchange.api.ratelimit.RateLimitOutcome;
import com.railexchange.api.ratelimit.RateLimitResult;
import com.railexchange.api.ratelimit.RateLimiterService;
import com.railexchange.api.support.MutableClock;
import com.railexchange.core.domain.AbuseSignals;
import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class AbusePreventionServiceTest {

    private static final String BODY = "Is the tank car still available?";

    private MutableClock clock;
    private LocalRateLimitStore store;
    private AbusePreventionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T00:00:00Z");
        store = new LocalRateLimitStore(clock);
        RateLimiterService limiter = new RateLimiterService(new RateLimitProperties(), store, Optional.empty());
        service = new AbusePreventionService(new ContentFilter(), new AbuseLockoutPolicy(), limiter, clock);
    }

    @Test
    void rejectedContentDoesNotConsumeAllowance() {
        EntitySnapshot sender = established().build();
        RateIdentity identity = new RateIdentity("1.2.3.4", "buyer-1");

        RateLimitResult rejected = service.checkInquiry(identity, true, sender, "call me at 555 0100");

        assertThat(rejected.outcome()).isEqualTo(RateLimitOutcome.CONTENT_REJECTED);
        assertThat(rejected.allowed()).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void newAccountGetsFiveInquiriesPerDay() {
        EntitySnapshot sender = EntitySnapshot.builder(EntityType.BUYER)
                .createdAt(clock.instant().minus(Duration.ofDays(2)))
                .build();
        RateIdentity identity = new RateIdentity("1.2.3.4", "buyer-new");

        for (int i = 0; i < 5; i++) {
            assertThat(service.checkInquiry(identity, true, sender, BODY).allowed()).isTrue();
            clock.advance(Duration.ofMinutes(61));
        }
        RateLimitResult sixth = service.checkInquiry(identity, true, sender, BODY);

        assertThat(sixth.allowed()).isFalse();
        assertThat(sixth.outcome()).isEqualTo(RateLimitOutcome.LIMITED);
    }

    @Test
    void emailUnverifiedSenderCannotInquire() {
        EntitySnapshot sender = established().emailVerified(false).build();

        RateLimitResult result = service.checkInquiry(RateIdentity.anonymous("1.2.3.4"), false, sender, BODY);

        assertThat(result.allowed()).isFalse();
        assertThat(result.message()).isNotBlank();
    }

    @Test
    void spamFlaggedSenderIsLockedOut() {
        EntitySnapshot sender = established()
                .abuseSignals(new AbuseSignals(0, 3, null, null, clock.instant().minus(Duration.ofHours(1))))
                .build();

        RateLimitResult result = service.checkInquiry(new RateIdentity("1.2.3.4", "spammer"), true, sender, BODY);

        assertThat(result.outcome()).isEqualTo(RateLimitOutcome.LOCKED_OUT);
        assertThat(result.retryAfterSeconds()).isEqualTo(Duration.ofHours(23).toSeconds());
    }

    @Test
    void hourlyInquiryLimitAppliesToUnverifiedSenders() {
        EntitySnapshot sender = established().build();
        RateIdentity identity = new RateIdentity("1.2.3.4", "buyer-2");

        for (int i = 0; i < 5; i++) {
            assertThat(service.checkInquiry(identity, false, sender, BODY).allowed()).isTrue();
        }

        assertThat(service.checkInquiry(identity, false, sender, BODY).allowed()).isFalse();
    }

    @Test
    void hourlyRejectionsDoNotSpendDailyAllowance() {
        EntitySnapshot sender = established().build();
        RateIdentity identity = new RateIdentity("1.2.3.4", "buyer-3");

        for (int hour = 0; hour < 4; hour++) {
            for (int i = 0; i < 5; i++) {
                assertThat(service.checkInquiry(identity, false, sender, BODY).allowed()).isTrue();
            }
            for (int i = 0; i < 2; i++) {
                assertThat(service.checkInquiry(identity, false, sender, BODY).allowed()).isFalse();
            }
            clock.advance(Duration.ofMinutes(61));
        }

        RateLimitResult overDaily = service.checkInquiry(identity, false, sender, BODY);
        assertThat(overDaily.allowed()).isFalse();
        assertThat(overDaily.retryAfterSeconds()).isGreaterThan(Duration.ofHours(1).toSeconds());
    }

    @Test
    void falseReporterIsLockedOut() {
        EntitySnapshot reporter = established()
                .abuseSignals(new AbuseSignals(3, 0, null, clock.instant(), null))
                .build();

        RateLimitResult result = service.checkReport(new RateIdentity("1.2.3.4", "reporter"), true, reporter);

        assertThat(result.outcome()).isEqualTo(RateLimitOutcome.LOCKED_OUT);
        assertThat(result.message()).isEqualTo("Report submission is temporarily unavailable.");
    }

    @Test
    void brandNewAccountCannotReport() {
        EntitySnapshot reporter = EntitySnapshot.builder(EntityType.BUYER)
                .createdAt(clock.instant().minus(Duration.ofHours(2)))
                .build();

        assertThat(service.checkReport(RateIdentity.anonymous("1.2.3.4"), false, reporter).allowed()).isFalse();
    }

    @Test
    void establishedReporterIsCountedAgainstReportLimit() {
        EntitySnapshot reporter = established().build();
        RateIdentity identity = new RateIdentity("1.2.3.4", "reporter-ok");

        for (int i = 0; i < 3; i++) {
            assertThat(service.checkReport(identity, false, reporter).allowed()).isTrue();
        }
        assertThat(service.checkReport(identity, false, reporter).allowed()).isFalse();
    }

    @Test
    void anonymousCallersAreDenied() {
        assertThat(service.checkInquiry(RateIdentity.anonymous("1.2.3.4"), false, null, BODY).allowed()).isFalse();
        assertThat(service.checkReport(RateIdentity.anonymous("1.2.3.4"), false, null).allowed()).isFalse();
    }

    @Test
    void validateInquiryContentReportsReason() {
        assertThat(service.validateInquiryContent(BODY)).isNull();
        assertThat(service.validateInquiryContent("www.cheap-rails.example"))
                .isEqualTo("External links are not allowed in inquiries.");
    }

    private EntitySnapshot.Builder established() {
        return EntitySnapshot.builder(EntityType.BUYER)
                .createdAt(clock.instant().minus(Duration.ofDays(30)));
    }
}
