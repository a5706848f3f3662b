package com.railexchange.api.subscription;

import com.railexchange.core.domain.SubscriptionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Confirms subscription and add-on payment state with the payment authority.
 *
 * The authority is the source of truth for every money-gated capability. Answers are cached
 * for a short TTL to keep hot pages off the network. Any failure to get an answer yields
 * {@code valid=false}: an outage or a timeout never grants access.
 */
@Service
public class SubscriptionVerifier {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionVerifier.class);

    static final String ERROR_NO_SUBSCRIPTION = "No subscription ID provided";
    static final String ERROR_UNAVAILABLE = "Payment verification unavailable";
    static final String ERROR_FAILED = "Failed to verify subscription status";
    static final String ERROR_MALFORMED = "Malformed subscription response";
    static final String ERROR_ENDED = "Subscription has ended";

    private static final String PAYMENT_SUCCEEDED = "succeeded";

    private final PaymentAuthority paymentAuthority;
    private final SubscriptionCache cache;

    public SubscriptionVerifier(PaymentAuthority paymentAuthority, SubscriptionCache cache) {
        this.paymentAuthority = paymentAuthority;
        this.cache = cache;
    }

    /**
     * Verifies a subscription. Valid only when the authority reports it active or trialing.
     */
    public SubscriptionVerification verify(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            return SubscriptionVerification.invalid(Source.AUTHORITY, ERROR_NO_SUBSCRIPTION);
        }

        Optional<SubscriptionVerification> cached = cache.get(subscriptionId);
        if (cached.isPresent()) {
            return cached.get().withSource(Source.CACHE);
        }

        if (!paymentAuthority.isConfigured()) {
            return SubscriptionVerification.invalid(Source.AUTHORITY, ERROR_UNAVAILABLE);
        }

        AuthoritySubscription answer;
        try {
            answer = paymentAuthority.retrieveSubscription(subscriptionId);
        } catch (RuntimeException e) {
            log.error("Subscription verification failed for {}", subscriptionId, e);
            return SubscriptionVerification.invalid(Source.AUTHORITY, ERROR_FAILED);
        }

        if (answer == null || answer.status() == null || answer.status().isBlank()) {
            log.error("Payment authority returned no status for subscription {}", subscriptionId);
            return SubscriptionVerification.invalid(Source.AUTHORITY, ERROR_MALFORMED);
        }

        SubscriptionStatus status = SubscriptionStatus.fromValue(answer.status());
        if (status == SubscriptionStatus.UNKNOWN) {
            log.warn("Unrecognised subscription status '{}' for {}", answer.status(), subscriptionId);
        }

        SubscriptionVerification verification = new SubscriptionVerification(
                status.grantsAccess(),
                status,
                answer.currentPeriodEnd(),
                answer.cancelAtPeriodEnd(),
                Source.AUTHORITY,
                null
        );
        cache.put(subscriptionId, verification);
        return verification;
    }

    /**
     * Verifies a subscription, short-circuiting on a locally recorded terminal status.
     * A subscription stored as canceled or expired is never revived without an external write,
     * so the authority is not called.
     */
    public SubscriptionVerification verifyWithStoredStatus(String subscriptionId, SubscriptionStatus storedStatus) {
        if (storedStatus != null && storedStatus.isTerminal()) {
            return new SubscriptionVerification(false, storedStatus, null, false, Source.DB_FALLBACK, ERROR_ENDED);
        }
        return verify(subscriptionId);
    }

    /**
     * Verifies a one-off add-on purchase. Valid only when the payment succeeded.
     * Not cached: add-on checks happen once at activation.
     */
    public PaymentVerification verifyAddOnPayment(String paymentIntentId) {
        if (paymentIntentId == null || paymentIntentId.isBlank()) {
            return new PaymentVerification(false, null, "No payment ID provided");
        }
        if (!paymentAuthority.isConfigured()) {
            return new PaymentVerification(false, null, ERROR_UNAVAILABLE);
        }
        try {
            String status = paymentAuthority.retrievePaymentStatus(paymentIntentId);
            boolean succeeded = status != null && PAYMENT_SUCCEEDED.equals(status.toLowerCase(Locale.ROOT));
            return new PaymentVerification(succeeded, status, null);
        } catch (RuntimeException e) {
            log.error("Add-on payment verification failed for {}", paymentIntentId, e);
            return new PaymentVerification(false, null, "Failed to verify payment");
        }
    }

    /**
     * Forces the next {@link #verify} for this id to reach the authority.
     */
    public void evict(String subscriptionId) {
        if (subscriptionId != null) {
            cache.evict(subscriptionId);
        }
    }

    public void evictAll() {
        cache.evictAll();
    }

    /**
     * Where a verification answer came from.
     */
    public enum Source {
        AUTHORITY("authority"),
        CACHE("cache"),
        DB_FALLBACK("db-fallback");

        private final String value;

        Source(String value) {
            this.value = value;
        }

        public String value() { return value; }
    }

    public record SubscriptionVerification(
            boolean valid,
            SubscriptionStatus status,
            Instant currentPeriodEnd,
            boolean cancelAtPeriodEnd,
            Source source,
            String error
    ) {
        static SubscriptionVerification invalid(Source source, String error) {
            return new SubscriptionVerification(false, null, null, false, source, error);
        }

        SubscriptionVerification withSource(Source newSource) {
            return new SubscriptionVerification(valid, status, currentPeriodEnd, cancelAtPeriodEnd, newSource, error);
        }
    }

    public record PaymentVerification(boolean valid, String status, String error) {}
}
