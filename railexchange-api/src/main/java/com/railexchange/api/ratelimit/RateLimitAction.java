package com.railexchange.api.ratelimit;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate-limited actions with their fixed window and default ceilings.
 * Unverified identities always get the stricter ceiling.
 */
public enum RateLimitAction {

    REGISTER("register", Duration.ofHours(1), 5, 3),
    LOGIN("login", Duration.ofMinutes(15), 10, 5),
    INQUIRY("inquiry", Duration.ofHours(1), 20, 5),
    REPORT("report", Duration.ofHours(1), 10, 3),
    LISTING("listing", Duration.ofHours(1), 15, 3),
    PASSWORD_RESET("password-reset", Duration.ofHours(1), 5, 3),
    CONTACT("contact", Duration.ofHours(1), 10, 5),
    SEARCH("search", Duration.ofMinutes(1), 60, 30),
    MESSAGES("messages", Duration.ofMinutes(1), 30, 10),
    PROMO_VALIDATE("promo-validate", Duration.ofHours(1), 10, 5);

    private final String key;
    private final Duration window;
    private final int verifiedCeiling;
    private final int unverifiedCeiling;

    RateLimitAction(String key, Duration window, int verifiedCeiling, int unverifiedCeiling) {
        this.key = key;
        this.window = window;
        this.verifiedCeiling = verifiedCeiling;
        this.unverifiedCeiling = unverifiedCeiling;
    }

    public String key() { return key; }
    public Duration window() { return window; }
    public int verifiedCeiling() { return verifiedCeiling; }
    public int unverifiedCeiling() { return unverifiedCeiling; }

    public static Optional<RateLimitAction> fromKey(String key) {
        for (RateLimitAction action : values()) {
            if (action.key.equals(key)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
