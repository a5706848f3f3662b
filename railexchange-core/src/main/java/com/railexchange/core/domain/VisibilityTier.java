package com.railexchange.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Paid ranking / exposure level, independent of verification.
 */
public enum VisibilityTier {

    HIDDEN("hidden", "Hidden"),       // not in the public directory
    BASIC("basic", "Basic"),          // standard placement
    FEATURED("featured", "Featured"), // enhanced placement
    PRIORITY("priority", "Priority"); // top placement

    private final String value;
    private final String label;

    VisibilityTier(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String value() { return value; }
    public String label() { return label; }

    /**
     * Tiers that carry a visibility boost on their own.
     */
    public boolean isBoosted() {
        return switch (this) {
            case FEATURED, PRIORITY -> true;
            case HIDDEN, BASIC -> false;
        };
    }

    /**
     * Directory ranking bonus contributed by the tier.
     */
    public int rankingBonus() {
        return switch (this) {
            case PRIORITY -> 300;
            case FEATURED -> 200;
            case BASIC -> 50;
            case HIDDEN -> 0;
        };
    }

    public static Optional<VisibilityTier> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VisibilityTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
