package com.railexchange.core.domain;

import java.util.Locale;

/**
 * Subscription lifecycle states as reported by the payment authority.
 * Anything the authority reports that is not listed here maps to {@link #UNKNOWN}.
 */
public enum SubscriptionStatus {

    ACTIVE("active"),
    TRIALING("trialing"),
    PAST_DUE("past_due"),
    INCOMPLETE("incomplete"),
    INCOMPLETE_EXPIRED("incomplete_expired"),
    UNPAID("unpaid"),
    PAUSED("paused"),
    CANCELED("canceled"),
    EXPIRED("expired"),
    UNKNOWN("unknown");

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    public String value() { return value; }

    /**
     * Only active and trialing subscriptions unlock paid capabilities.
     */
    public boolean grantsAccess() {
        return switch (this) {
            case ACTIVE, TRIALING -> true;
            case PAST_DUE, INCOMPLETE, INCOMPLETE_EXPIRED, UNPAID, PAUSED, CANCELED, EXPIRED, UNKNOWN -> false;
        };
    }

    /**
     * States in which the locally stored status is final and no authority call can improve it.
     */
    public boolean isTerminal() {
        return this == CANCELED || this == EXPIRED;
    }

    public static SubscriptionStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("cancelled".equals(normalized)) {
            return CANCELED;
        }
        for (SubscriptionStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
