package com.railexchange.api.subscription;

import com.railexchange.api.subscription.SubscriptionVerifier.SubscriptionVerification;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache of successful authority answers, keyed by subscription id.
 *
 * Only definitive authority answers are stored; failures are never cached. Concurrent
 * writes for the same id are last-writer-wins.
 */
@Component
public class SubscriptionCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public SubscriptionCache(Clock clock,
                             @Value("${railexchange.subscription.cache-ttl:PT5M}") Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public SubscriptionCache(Clock clock) {
        this(clock, DEFAULT_TTL);
    }

    /**
     * @return the cached answer if it is younger than the TTL
     */
    public Optional<SubscriptionVerification> get(String subscriptionId) {
        Entry entry = entries.get(subscriptionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.cachedAt().plus(ttl).isAfter(clock.instant())) {
            entries.remove(subscriptionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.verification());
    }

    public void put(String subscriptionId, SubscriptionVerification verification) {
        entries.put(subscriptionId, new Entry(verification, clock.instant()));
    }

    public void evict(String subscriptionId) {
        entries.remove(subscriptionId);
    }

    public void evictAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(SubscriptionVerification verification, Instant cachedAt) {}
}
