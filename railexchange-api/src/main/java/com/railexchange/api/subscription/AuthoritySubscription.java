package com.railexchange.api.subscription;

import java.time.Instant;

/**
 * Subscription state as reported by the payment authority, before interpretation.
 *
 * @param status           raw status string; null when the response was malformed
 * @param currentPeriodEnd end of the paid period, if reported
 */
public record AuthoritySubscription(String status, Instant currentPeriodEnd, boolean cancelAtPeriodEnd) {
}
