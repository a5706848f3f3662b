package com.railexchange.api.ratelimit;

import java.time.Duration;

/**
 * Fixed-window counter store.
 *
 * The first request for a key opens a window of the given length; each request counts one;
 * once the count passes the ceiling the request is rejected until the window closes.
 */
public interface RateLimitStore {

    WindowDecision tryAcquire(String key, int ceiling, Duration window);

    /**
     * True when counters are shared across instances.
     */
    boolean isDistributed();

    /**
     * @param retryAfterSeconds seconds until the window closes, set when rejected
     */
    record WindowDecision(boolean allowed, int remaining, long retryAfterSeconds) {}
}
