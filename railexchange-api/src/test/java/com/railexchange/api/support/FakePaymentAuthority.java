package com.railexchange.api.support;

import com.railexchange.api.subscription.AuthoritySubscription;
import com.railexchange.api.subscription.PaymentAuthority;
import com.railexchange.api.subscription.PaymentAuthorityException;

import java.util.HashMap;
import java.util.Map;

/**
 * Scriptable payment authority that counts calls.
 */
public final class FakePaymentAuthority implements PaymentAuthority {

    private final Map<String, AuthoritySubscription> subscriptions = new HashMap<>();
    private final Map<String, String> payments = new HashMap<>();
    private boolean failing;
    private int subscriptionCalls;
    private int paymentCalls;

    public FakePaymentAuthority withSubscription(String id, AuthoritySubscription subscription) {
        subscriptions.put(id, subscription);
        return this;
    }

    public FakePaymentAuthority withPayment(String id, String status) {
        payments.put(id, status);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int subscriptionCalls() { return subscriptionCalls; }
    public int paymentCalls() { return paymentCalls; }

    @Override
    public AuthoritySubscription retrieveSubscription(String subscriptionId) {
        subscriptionCalls++;
        if (failing) {
            throw new PaymentAuthorityException("authority outage");
        }
        AuthoritySubscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            throw new PaymentAuthorityException("No such subscription: " + subscriptionId);
        }
        return subscription;
    }

    @Override
    public String retrievePaymentStatus(String paymentIntentId) {
        paymentCalls++;
        if (failing) {
            throw new PaymentAuthorityException("authority outage");
        }
        String status = payments.get(paymentIntentId);
        if (status == null) {
            throw new PaymentAuthorityException("No such payment: " + paymentIntentId);
        }
        return status;
    }
}
