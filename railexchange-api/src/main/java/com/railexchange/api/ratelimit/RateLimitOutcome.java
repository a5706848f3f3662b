package com.railexchange.api.ratelimit;

/**
 * Why a check ended the way it did. ERROR is kept apart from the abuse outcomes so callers
 * can tell infrastructure trouble from a misbehaving client.
 */
public enum RateLimitOutcome {
    ALLOWED,
    LIMITED,
    LOCKED_OUT,
    CONTENT_REJECTED,
    ERROR
}
