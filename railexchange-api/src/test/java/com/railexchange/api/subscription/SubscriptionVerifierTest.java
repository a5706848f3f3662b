package com.railexchange.api.subscription;

import com.railexchange.api.subscription.SubscriptionVerifier.PaymentVerification;
import com.railexchange.api.subscription.SubscriptionVerifier.Source;
import com.railexchange.api.subscription.SubscriptionVerifier.SubscriptionVerification;
import com.railexchange.api.support.FakePaymentAuthority;
import com.railexchange.api.support.MutableClock;
import com.railexchange.core.domain.SubscriptionStatus;
import net.jqwik.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Subscription verification against a scripted payment authority. No mocks.
 */
class SubscriptionVerifierTest {

    private static final Instant PERIOD_END = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private FakePaymentAuthority authority;
    private SubscriptionVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T00:00:00Z");
        authority = new FakePaymentAuthority()
                .withSubscription("sub_active", new AuthoritySubscription("active", PERIOD_END, false))
                .withSubscription("sub_trial", new AuthoritySubscription("trialing", PERIOD_END, true))
                .withSubscription("sub_past_due", new AuthoritySubscription("past_due", PERIOD_END, false))
                .withSubscription("sub_malformed", new AuthoritySubscription(null, null, false))
                .withPayment("pi_ok", "succeeded")
                .withPayment("pi_pending", "processing");
        verifier = new SubscriptionVerifier(authority, new SubscriptionCache(clock));
    }

    @Test
    void activeSubscriptionIsValidAndCached() {
        SubscriptionVerification first = verifier.verify("sub_active");
        SubscriptionVerification second = verifier.verify("sub_active");

        assertThat(first.valid()).isTrue();
        assertThat(first.status()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(first.currentPeriodEnd()).isEqualTo(PERIOD_END);
        assertThat(first.source()).isEqualTo(Source.AUTHORITY);

        assertThat(second.source()).isEqualTo(Source.CACHE);
        assertThat(second.valid()).isEqualTo(first.valid());
        assertThat(second.status()).isEqualTo(first.status());
        assertThat(second.currentPeriodEnd()).isEqualTo(first.currentPeriodEnd());
        assertThat(second.cancelAtPeriodEnd()).isEqualTo(first.cancelAtPeriodEnd());
        assertThat(authority.subscriptionCalls()).isEqualTo(1);
    }

    @Test
    void trialingIsValidPastDueIsNot() {
        assertThat(verifier.verify("sub_trial").valid()).isTrue();
        assertThat(verifier.verify("sub_trial").cancelAtPeriodEnd()).isTrue();
        assertThat(verifier.verify("sub_past_due").valid()).isFalse();
        assertThat(verifier.verify("sub_past_due").status()).isEqualTo(SubscriptionStatus.PAST_DUE);
    }

    @Test
    void staleEntryIsRefetchedAndOutageDenies() {
        assertThat(verifier.verify("sub_active").valid()).isTrue();

        clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        authority.setFailing(true);

        SubscriptionVerification result = verifier.verify("sub_active");

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Failed to verify subscription status");
        assertThat(authority.subscriptionCalls()).isEqualTo(2);
    }

    @Test
    void entryYoungerThanTtlIsServedDuringOutage() {
        verifier.verify("sub_active");
        clock.advance(Duration.ofMinutes(4));
        authority.setFailing(true);

        SubscriptionVerification result = verifier.verify("sub_active");

        assertThat(result.valid()).isTrue();
        assertThat(result.source()).isEqualTo(Source.CACHE);
    }

    @Test
    void failuresAreNotCached() {
        authority.setFailing(true);
        verifier.verify("sub_active");
        authority.setFailing(false);

        SubscriptionVerification result = verifier.verify("sub_active");

        assertThat(result.valid()).isTrue();
        assertThat(result.source()).isEqualTo(Source.AUTHORITY);
    }

    @Test
    void blankIdIsInvalidWithoutCallingAuthority() {
        assertThat(verifier.verify(null).valid()).isFalse();
        assertThat(verifier.verify("  ").valid()).isFalse();
        assertThat(verifier.verify(null).source()).isEqualTo(Source.AUTHORITY);
        assertThat(authority.subscriptionCalls()).isZero();
    }

    @Test
    void malformedResponseFailsClosed() {
        SubscriptionVerification result = verifier.verify("sub_malformed");

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isNotBlank();
        assertThat(verifier.verify("sub_malformed").source()).isEqualTo(Source.AUTHORITY);
    }

    @Test
    void storedTerminalStatusShortCircuits() {
        SubscriptionVerification result = verifier.verifyWithStoredStatus("sub_active", SubscriptionStatus.CANCELED);

        assertThat(result.valid()).isFalse();
        assertThat(result.source()).isEqualTo(Source.DB_FALLBACK);
        assertThat(result.source().value()).isEqualTo("db-fallback");
        assertThat(authority.subscriptionCalls()).isZero();
    }

    @Test
    void storedNonTerminalStatusDefersToAuthority() {
        SubscriptionVerification result = verifier.verifyWithStoredStatus("sub_active", SubscriptionStatus.PAST_DUE);

        assertThat(result.valid()).isTrue();
        assertThat(result.source()).isEqualTo(Source.AUTHORITY);
    }

    @Test
    void unconfiguredAuthorityAlwaysDenies() {
        SubscriptionVerifier unconfigured = new SubscriptionVerifier(
                new UnconfiguredPaymentAuthority(), new SubscriptionCache(clock));

        SubscriptionVerification result = unconfigured.verify("sub_active");

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Payment verification unavailable");
        assertThat(unconfigured.verifyAddOnPayment("pi_ok").valid()).isFalse();
    }

    @Test
    void evictForcesRefresh() {
        verifier.verify("sub_active");
        verifier.evict("sub_active");
        verifier.verify("sub_active");
        verifier.evictAll();
        verifier.verify("sub_active");

        assertThat(authority.subscriptionCalls()).isEqualTo(3);
    }

    @Test
    void addOnPaymentValidOnlyWhenSucceeded() {
        PaymentVerification ok = verifier.verifyAddOnPayment("pi_ok");
        PaymentVerification pending = verifier.verifyAddOnPayment("pi_pending");
        PaymentVerification missing = verifier.verifyAddOnPayment("pi_missing");

        assertThat(ok.valid()).isTrue();
        assertThat(pending.valid()).isFalse();
        assertThat(pending.status()).isEqualTo("processing");
        assertThat(missing.valid()).isFalse();
        assertThat(missing.error()).isNotBlank();
        assertThat(verifier.verifyAddOnPayment(null).valid()).isFalse();
    }

    @Property(tries = 100)
    void outageNeverGrantsAccess(@ForAll("subscriptionIds") String subscriptionId) {
        FakePaymentAuthority down = new FakePaymentAuthority();
        down.setFailing(true);
        SubscriptionVerifier failing = new SubscriptionVerifier(down, new SubscriptionCache(clock()));

        assertThat(failing.verify(subscriptionId).valid()).isFalse();
        assertThat(failing.verifyWithStoredStatus(subscriptionId, SubscriptionStatus.ACTIVE).valid()).isFalse();
    }

    @Provide
    Arbitrary<String> subscriptionIds() {
        return Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(20).map(s -> "sub_" + s);
    }

    private static MutableClock clock() {
        return MutableClock.startingAt("2025-06-01T00:00:00Z");
    }
}
