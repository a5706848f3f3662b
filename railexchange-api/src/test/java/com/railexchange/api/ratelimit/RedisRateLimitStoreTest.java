package com.railexchange.api.ratelimit;

import com.railexchange.api.config.RateLimitProperties;
import com.railexchange.api.ratelimit.RateLimitStore.WindowDecision;
import com.railexchange.api.support.MutableClock;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Window decisions taken from the counter script's {count, ttl} reply.
 */
class RedisRateLimitStoreTest {

    private ScriptedRedisTemplate redis;
    private RedisRateLimitStore store;

    @BeforeEach
    void setUp() {
        redis = new ScriptedRedisTemplate();
        store = new RedisRateLimitStore(redis);
    }

    @Test
    void scriptIncrementsExpiresAndReadsTtlInOneCall() {
        redis.reply(Arrays.asList(1L, 3600L));

        store.tryAcquire("ratelimit:register:1.2.3.4:anon", 3, Duration.ofHours(1));

        assertThat(redis.calls).isEqualTo(1);
        assertThat(redis.lastKeys).containsExactly("ratelimit:register:1.2.3.4:anon");
        assertThat(redis.lastArgs).containsExactly("3600");
        assertThat(redis.lastScript.getScriptAsString())
                .contains("INCR")
                .contains("EXPIRE")
                .contains("TTL")
                .contains("if ttl < 0 then");
        assertThat(redis.lastScript.getResultType()).isEqualTo(List.class);
    }

    @Property(tries = 200)
    void countAtOrBelowCeilingIsAllowed(@ForAll @IntRange(min = 1, max = 100) int ceiling,
                                        @ForAll @IntRange(min = 1, max = 100) int count) {
        Assume.that(count <= ceiling);
        ScriptedRedisTemplate template = new ScriptedRedisTemplate();
        template.reply(Arrays.asList((long) count, 42L));

        WindowDecision decision = new RedisRateLimitStore(template).tryAcquire("k", ceiling, Duration.ofMinutes(1));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(ceiling - count);
        assertThat(decision.retryAfterSeconds()).isZero();
    }

    @Test
    void countPastCeilingIsRejectedWithWindowTtl() {
        redis.reply(Arrays.asList(4L, 1234L));

        WindowDecision decision = store.tryAcquire("k", 3, Duration.ofHours(1));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.remaining()).isZero();
        assertThat(decision.retryAfterSeconds()).isEqualTo(1234L);
    }

    @Test
    void missingTtlFallsBackToWindowLength() {
        redis.reply(Arrays.asList(9L, -1L));

        WindowDecision decision = store.tryAcquire("k", 3, Duration.ofMinutes(15));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfterSeconds()).isEqualTo(Duration.ofMinutes(15).toSeconds());
    }

    @Test
    void subSecondWindowStillExpires() {
        redis.reply(Arrays.asList(1L, 1L));

        store.tryAcquire("k", 3, Duration.ofMillis(200));

        assertThat(redis.lastArgs).containsExactly("1");
    }

    @Test
    void stringRepliesAreParsed() {
        redis.reply(Arrays.asList("2", "30"));

        WindowDecision decision = store.tryAcquire("k", 5, Duration.ofMinutes(1));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(3);
    }

    @Test
    void malformedReplyIsAnError() {
        redis.reply(null);
        assertThatThrownBy(() -> store.tryAcquire("k", 5, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalStateException.class);

        redis.reply(List.of(1L));
        assertThatThrownBy(() -> store.tryAcquire("k", 5, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void malformedReplyDeniesThroughLimiter() {
        MutableClock clock = MutableClock.startingAt("2025-06-01T00:00:00Z");
        RateLimiterService limiter = new RateLimiterService(
                new RateLimitProperties(), new LocalRateLimitStore(clock), Optional.of(store));
        redis.reply(List.of(1L));

        RateLimitResult result = limiter.checkLimit(RateLimitAction.LOGIN, RateIdentity.anonymous("1.2.3.4"), false);

        assertThat(result.allowed()).isFalse();
        assertThat(result.outcome()).isEqualTo(RateLimitOutcome.ERROR);
        assertThat(result.retryAfterSeconds()).isEqualTo(60L);
    }

    @Test
    void sharedCounterRejectsOnceAnyInstancePassesCeiling() {
        MutableClock clock = MutableClock.startingAt("2025-06-01T00:00:00Z");
        RateLimiterService limiter = new RateLimiterService(
                new RateLimitProperties(), new LocalRateLimitStore(clock), Optional.of(store));
        RateIdentity identity = RateIdentity.anonymous("1.2.3.4");
        // another instance has already counted three registrations in this window
        redis.reply(Arrays.asList(4L, 1800L));

        RateLimitResult result = limiter.checkLimit(RateLimitAction.REGISTER, identity, false);

        assertThat(result.allowed()).isFalse();
        assertThat(result.outcome()).isEqualTo(RateLimitOutcome.LIMITED);
        assertThat(result.retryAfterSeconds()).isEqualTo(1800L);
        assertThat(redis.lastKeys).containsExactly("ratelimit:register:1.2.3.4:anon");
    }

    /**
     * Returns queued script replies instead of talking to Redis.
     */
    static final class ScriptedRedisTemplate extends StringRedisTemplate {
        private final Deque<Optional<List<?>>> replies = new ArrayDeque<>();
        private RedisScript<?> lastScript;
        private List<String> lastKeys;
        private List<Object> lastArgs;
        private int calls;

        void reply(List<?> result) {
            replies.add(Optional.ofNullable(result));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T execute(RedisScript<T> script, List<String> keys, Object... args) {
            calls++;
            lastScript = script;
            lastKeys = keys;
            lastArgs = Arrays.asList(args);
            Optional<List<?>> next = replies.poll();
            return next == null ? null : (T) next.orElse(null);
        }
    }
}
