package com.railexchange.api.subscription;

import com.railexchange.api.config.PaymentAuthorityProperties;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Subscription;
import com.stripe.net.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Stripe-backed payment authority.
 *
 * Uses per-request options rather than the global {@code Stripe.apiKey} so the key and
 * timeouts stay scoped to this adapter. Network retries are disabled.
 */
public class StripePaymentAuthority implements PaymentAuthority {

    private static final Logger log = LoggerFactory.getLogger(StripePaymentAuthority.class);

    private final RequestOptions requestOptions;

    public StripePaymentAuthority(PaymentAuthorityProperties properties) {
        this.requestOptions = RequestOptions.builder()
                .setApiKey(properties.getSecretKey())
                .setConnectTimeout(properties.getConnectTimeoutMillis())
                .setReadTimeout(properties.getReadTimeoutMillis())
                .setMaxNetworkRetries(0)
                .build();
        log.info("Stripe payment authority initialized (connect timeout {} ms, read timeout {} ms)",
                properties.getConnectTimeoutMillis(), properties.getReadTimeoutMillis());
    }

    @Override
    public AuthoritySubscription retrieveSubscription(String subscriptionId) {
        try {
            Subscription subscription = Subscription.retrieve(subscriptionId, requestOptions);
            Long periodEnd = subscription.getCurrentPeriodEnd();
            return new AuthoritySubscription(
                    subscription.getStatus(),
                    periodEnd == null ? null : Instant.ofEpochSecond(periodEnd),
                    Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd())
            );
        } catch (StripeException e) {
            throw new PaymentAuthorityException("Failed to retrieve subscription " + subscriptionId, e);
        }
    }

    @Override
    public String retrievePaymentStatus(String paymentIntentId) {
        try {
            return PaymentIntent.retrieve(paymentIntentId, requestOptions).getStatus();
        } catch (StripeException e) {
            throw new PaymentAuthorityException("Failed to retrieve payment " + paymentIntentId, e);
        }
    }
}
