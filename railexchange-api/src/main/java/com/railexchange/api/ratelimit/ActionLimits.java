package com.railexchange.api.ratelimit;

import java.time.Duration;

/**
 * Effective window and ceilings for one action.
 */
public record ActionLimits(Duration window, int verifiedCeiling, int unverifiedCeiling) {

    public int ceilingFor(boolean isVerified) {
        return isVerified ? verifiedCeiling : unverifiedCeiling;
    }
}
