package com.railexchange.api.subscription;

/**
 * Stand-in used when no payment authority credentials are configured.
 * Every call fails, so every money-gated check fails closed.
 */
public class UnconfiguredPaymentAuthority implements PaymentAuthority {

    static final String UNAVAILABLE = "Payment verification unavailable";

    @Override
    public boolean isConfigured() {
        return false;
    }

    @Override
    public AuthoritySubscription retrieveSubscription(String subscriptionId) {
        throw new PaymentAuthorityException(UNAVAILABLE);
    }

    @Override
    public String retrievePaymentStatus(String paymentIntentId) {
        throw new PaymentAuthorityException(UNAVAILABLE);
    }
}
