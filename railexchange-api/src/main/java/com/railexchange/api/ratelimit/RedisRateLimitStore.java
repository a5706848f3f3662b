package com.railexchange.api.ratelimit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed fixed-window counters, shared by every instance.
 *
 * One Lua script increments the counter, sets the expiry when the window opens and reads the
 * remaining TTL, so a crash between the steps can never leave a counter without an expiry.
 * Connection and command failures propagate as Spring {@code DataAccessException}s.
 */
@Component("distributedRateLimitStore")
@ConditionalOnProperty(prefix = "railexchange.rate-limit.redis", name = "enabled", havingValue = "true")
public class RedisRateLimitStore implements RateLimitStore {

    static final String WINDOW_SCRIPT =
            "local count = redis.call('INCR', KEYS[1])\n" +
            "if count == 1 then\n" +
            "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n" +
            "end\n" +
            "local ttl = redis.call('TTL', KEYS[1])\n" +
            "if ttl < 0 then\n" +
            "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n" +
            "  ttl = tonumber(ARGV[1])\n" +
            "end\n" +
            "return {count, ttl}";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List> windowScript;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.windowScript = new DefaultRedisScript<>();
        this.windowScript.setScriptText(WINDOW_SCRIPT);
        this.windowScript.setResultType(List.class);
    }

    @Override
    public WindowDecision tryAcquire(String key, int ceiling, Duration window) {
        long windowSeconds = Math.max(1, window.toSeconds());
        List<?> result = redisTemplate.execute(windowScript, List.of(key), String.valueOf(windowSeconds));
        if (result == null || result.size() < 2) {
            throw new IllegalStateException("Unexpected rate limit script result for " + key);
        }

        long count = toLong(result.get(0));
        long ttl = toLong(result.get(1));

        if (count > ceiling) {
            return new WindowDecision(false, 0, ttl > 0 ? ttl : windowSeconds);
        }
        return new WindowDecision(true, (int) Math.max(0, ceiling - count), 0);
    }

    @Override
    public boolean isDistributed() {
        return true;
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
