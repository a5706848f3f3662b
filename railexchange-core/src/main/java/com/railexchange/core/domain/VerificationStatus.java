package com.railexchange.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of the identity / business-legitimacy review.
 * Transitions happen through the external review workflow; this code only reads it.
 */
public enum VerificationStatus {

    NONE("none", "Not Verified"),
    PENDING("pending", "Verification Pending"),
    VERIFIED("verified", "Verified"),
    EXPIRED("expired", "Verification Expired"),
    REJECTED("rejected", "Verification Rejected");

    private final String value;
    private final String label;

    VerificationStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String value() { return value; }
    public String label() { return label; }

    public static Optional<VerificationStatus> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VerificationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
