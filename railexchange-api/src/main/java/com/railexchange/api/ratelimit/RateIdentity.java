package com.railexchange.api.ratelimit;

/**
 * Who is being limited: the client address plus the authenticated user, if any.
 * Anonymous callers share the per-address counter.
 */
public record RateIdentity(String ip, String userId) {

    public static final String UNKNOWN_IP = "unknown";
    public static final String ANONYMOUS = "anon";

    public RateIdentity {
        if (ip == null || ip.isBlank()) {
            ip = UNKNOWN_IP;
        }
        if (userId != null && userId.isBlank()) {
            userId = null;
        }
    }

    public static RateIdentity anonymous(String ip) {
        return new RateIdentity(ip, null);
    }

    /**
     * Counter key, e.g. {@code ratelimit:register:1.2.3.4:anon}.
     */
    public String key(String scope) {
        return "ratelimit:" + scope + ":" + ip + ":" + (userId != null ? userId : ANONYMOUS);
    }
}
