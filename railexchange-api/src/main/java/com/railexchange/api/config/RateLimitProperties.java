package com.railexchange.api.config;

import com.railexchange.api.ratelimit.ActionLimits;
import com.railexchange.api.ratelimit.RateLimitAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Rate limit overrides, keyed by action key:
 *
 * <pre>
 * railexchange.rate-limit.actions.inquiry.verified=30
 * railexchange.rate-limit.actions.inquiry.unverified=8
 * </pre>
 *
 * Overrides are never trusted blindly. An unverified ceiling that is not strictly below the
 * verified one is clamped and logged.
 */
@Configuration
@ConfigurationProperties(prefix = "railexchange.rate-limit")
public class RateLimitProperties {

    private static final Logger log = LoggerFactory.getLogger(RateLimitProperties.class);

    private Map<String, Ceilings> actions = new HashMap<>();
    private Redis redis = new Redis();

    public Map<String, Ceilings> getActions() { return actions; }
    public void setActions(Map<String, Ceilings> actions) { this.actions = actions; }
    public Redis getRedis() { return redis; }
    public void setRedis(Redis redis) { this.redis = redis; }

    /**
     * Effective limits for every action, defaults merged with overrides.
     */
    public Map<RateLimitAction, ActionLimits> resolveLimits() {
        Map<RateLimitAction, ActionLimits> limits = new EnumMap<>(RateLimitAction.class);
        for (RateLimitAction action : RateLimitAction.values()) {
            limits.put(action, resolve(action, actions.get(action.key())));
        }
        for (String key : actions.keySet()) {
            if (RateLimitAction.fromKey(key).isEmpty()) {
                log.warn("Ignoring rate limit override for unknown action '{}'", key);
            }
        }
        return limits;
    }

    static ActionLimits resolve(RateLimitAction action, Ceilings override) {
        int verified = action.verifiedCeiling();
        int unverified = action.unverifiedCeiling();

        if (override != null) {
            if (override.getVerified() != null) {
                if (override.getVerified() < 1) {
                    log.warn("Verified ceiling {} for '{}' is below 1, keeping default {}",
                            override.getVerified(), action.key(), verified);
                } else {
                    verified = override.getVerified();
                }
            }
            if (override.getUnverified() != null) {
                unverified = override.getUnverified();
            }
        }

        if (unverified >= verified || unverified < 0) {
            int clamped = Math.max(0, verified - 1);
            log.warn("Unverified ceiling {} for '{}' must be below verified ceiling {}, clamping to {}",
                    unverified, action.key(), verified, clamped);
            unverified = clamped;
        }

        return new ActionLimits(action.window(), verified, unverified);
    }

    public static class Ceilings {
        private Integer verified;
        private Integer unverified;

        public Ceilings() {}

        public Ceilings(Integer verified, Integer unverified) {
            this.verified = verified;
            this.unverified = unverified;
        }

        public Integer getVerified() { return verified; }
        public void setVerified(Integer verified) { this.verified = verified; }
        public Integer getUnverified() { return unverified; }
        public void setUnverified(Integer unverified) { this.unverified = unverified; }
    }

    public static class Redis {
        private boolean enabled;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
