package com.railexchange.api.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-instance counters on Bucket4j buckets. Used when Redis is not configured or not reachable.
 *
 * Each bucket holds {@code ceiling} tokens and is refilled in full once per window, which gives
 * fixed-window behaviour starting from the first request. Counters are not shared between
 * instances, so the effective limit scales with the number of instances.
 */
@Component
public class LocalRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(LocalRateLimitStore.class);

    private final Map<String, LocalWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final TimeMeter timeMeter;

    public LocalRateLimitStore(Clock clock) {
        this.clock = clock;
        this.timeMeter = new ClockTimeMeter(clock);
    }

    @Override
    public WindowDecision tryAcquire(String key, int ceiling, Duration window) {
        if (ceiling <= 0) {
            return new WindowDecision(false, 0, Math.max(1, window.toSeconds()));
        }

        LocalWindow localWindow = windows.computeIfAbsent(
                key + ":" + ceiling + ":" + window.toSeconds(),
                k -> new LocalWindow(createBucket(ceiling, window), window, clock.millis()));
        localWindow.touch(clock.millis());

        ConsumptionProbe probe = localWindow.bucket().tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return new WindowDecision(true, (int) probe.getRemainingTokens(), 0);
        }
        return new WindowDecision(false, 0, toRetrySeconds(probe.getNanosToWaitForRefill()));
    }

    @Override
    public boolean isDistributed() {
        return false;
    }

    /**
     * Drops windows that have been idle for longer than their own length. Such a bucket would
     * already be refilled in full, so dropping it loses nothing.
     */
    @Scheduled(fixedRateString = "${railexchange.rate-limit.local.eviction-interval-ms:60000}")
    public void evictIdle() {
        long now = clock.millis();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isIdle(now));
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle local rate limit windows", evicted);
        }
    }

    public int size() {
        return windows.size();
    }

    private Bucket createBucket(int ceiling, Duration window) {
        Bandwidth limit = Bandwidth.classic(ceiling, Refill.intervally(ceiling, window));
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private static long toRetrySeconds(long nanos) {
        long seconds = (nanos + 999_999_999L) / 1_000_000_000L;
        return Math.max(1, seconds);
    }

    private static final class LocalWindow {
        private final Bucket bucket;
        private final long windowMillis;
        private volatile long lastAccessMillis;

        LocalWindow(Bucket bucket, Duration window, long createdMillis) {
            this.bucket = bucket;
            this.windowMillis = window.toMillis();
            this.lastAccessMillis = createdMillis;
        }

        Bucket bucket() { return bucket; }

        void touch(long nowMillis) {
            lastAccessMillis = nowMillis;
        }

        boolean isIdle(long nowMillis) {
            return nowMillis - lastAccessMillis > windowMillis;
        }
    }

    /**
     * Drives Bucket4j refills from the injected clock.
     */
    private static final class ClockTimeMeter implements TimeMeter {
        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return clock.millis() * 1_000_000L;
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
