package com.railexchange.api.ratelimit;

import com.railexchange.api.config.RateLimitProperties;
import com.railexchange.api.ratelimit.RateLimitStore.WindowDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-window rate limiting per action and identity.
 *
 * Counts go to Redis when it is configured. When Redis cannot be reached the check is served
 * from the per-instance store instead. Any other failure, including a command timeout, denies
 * the request: a check that cannot complete never allows.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final Map<RateLimitAction, ActionLimits> limits;
    private final LocalRateLimitStore localStore;
    private final RateLimitStore distributedStore;

    public RateLimiterService(RateLimitProperties properties,
                              LocalRateLimitStore localStore,
                              @Qualifier("distributedRateLimitStore") Optional<RateLimitStore> distributedStore) {
        this.limits = properties.resolveLimits();
        this.localStore = localStore;
        this.distributedStore = distributedStore.orElse(null);

        if (this.distributedStore == null) {
            if (properties.getRedis().isEnabled()) {
                log.warn("Redis rate limiting is enabled but no distributed store is available, using local counters");
            } else {
                log.info("Redis rate limiting disabled, using local counters");
            }
        }
    }

    /**
     * Counts one attempt of {@code action} for {@code identity}.
     */
    public RateLimitResult checkLimit(RateLimitAction action, RateIdentity identity, boolean isVerified) {
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(identity, "Identity cannot be null");

        ActionLimits actionLimits = limits.get(action);
        return check(identity.key(action.key()), actionLimits.ceilingFor(isVerified), actionLimits.window());
    }

    /**
     * Counts one attempt against an ad-hoc window, e.g. a daily allowance.
     */
    public RateLimitResult checkWindow(String scope, RateIdentity identity, int ceiling, Duration window) {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(identity, "Identity cannot be null");
        return check(identity.key(scope), ceiling, window);
    }

    public int ceilingFor(RateLimitAction action, boolean isVerified) {
        return limits.get(action).ceilingFor(isVerified);
    }

    public boolean isDistributedActive() {
        return distributedStore != null;
    }

    private RateLimitResult check(String key, int ceiling, Duration window) {
        if (distributedStore != null) {
            try {
                return toResult(distributedStore.tryAcquire(key, ceiling, window));
            } catch (RedisConnectionFailureException e) {
                log.warn("Redis unreachable, serving rate limit for {} from local counters: {}", key, e.getMessage());
            } catch (QueryTimeoutException e) {
                log.warn("Rate limit check timed out for {}, denying", key);
                return RateLimitResult.error();
            } catch (RuntimeException e) {
                log.warn("Rate limit check failed for {}, denying", key, e);
                return RateLimitResult.error();
            }
        }

        try {
            return toResult(localStore.tryAcquire(key, ceiling, window));
        } catch (RuntimeException e) {
            log.warn("Local rate limit check failed for {}, denying", key, e);
            return RateLimitResult.error();
        }
    }

    private static RateLimitResult toResult(WindowDecision decision) {
        if (decision.allowed()) {
            return RateLimitResult.allowed(decision.remaining());
        }
        return RateLimitResult.limited(decision.retryAfterSeconds());
    }
}
