package com.railexchange.api.subscription;

/**
 * Source of truth for subscription and payment state.
 *
 * Implementations make one synchronous attempt per call, with no internal retries, and
 * signal every failure (network, timeout, outage, missing credentials) by throwing
 * {@link PaymentAuthorityException}.
 */
public interface PaymentAuthority {

    AuthoritySubscription retrieveSubscription(String subscriptionId);

    /**
     * @return the authority's raw status for a one-off payment, e.g. {@code succeeded}
     */
    String retrievePaymentStatus(String paymentIntentId);

    /**
     * False when the adapter has no credentials and cannot answer at all.
     */
    default boolean isConfigured() {
        return true;
    }
}
