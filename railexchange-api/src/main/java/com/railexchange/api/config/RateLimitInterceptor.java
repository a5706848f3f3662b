package com.railexchange.api.config;

import com.railexchange.api.ratelimit.RateIdentity;
import com.railexchange.api.ratelimit.RateLimitAction;
import com.railexchange.api.ratelimit.RateLimitResult;
import com.railexchange.api.ratelimit.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.security.Principal;
import java.util.Optional;

/**
 * Applies per-action rate limits to inbound API requests before any handler runs.
 *
 * Rejections answer 429 with {@code Retry-After} and {@code X-RateLimit-Remaining} headers and
 * a short JSON body. Requests that map to no action pass through untouched.
 *
 * Inquiries and reports are not counted here. Their handlers go through
 * {@code AbusePreventionService}, which filters content and applies lockouts before counting.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    /**
     * Request attribute set by the authentication layer when the caller is a verified account.
     */
    public static final String VERIFIED_ATTRIBUTE = "railexchange.verified";

    private final RateLimiterService rateLimiter;

    public RateLimitInterceptor(RateLimiterService rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        Optional<RateLimitAction> action = resolveAction(request.getMethod(), request.getRequestURI());
        if (action.isEmpty()) {
            return true;
        }

        RateIdentity identity = resolveIdentity(request);
        RateLimitResult result = rateLimiter.checkLimit(action.get(), identity, isVerified(request));

        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.remaining()));
        if (result.allowed()) {
            return true;
        }

        if (result.retryAfterSeconds() != null) {
            response.setHeader("Retry-After", String.valueOf(result.retryAfterSeconds()));
        }
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_001\",\"message\":\"" + result.message() + "\"}");
        return false;
    }

    static Optional<RateLimitAction> resolveAction(String method, String path) {
        if (path == null) {
            return Optional.empty();
        }
        boolean post = "POST".equalsIgnoreCase(method);
        boolean get = "GET".equalsIgnoreCase(method);

        if (post && path.contains("/auth/register")) {
            return Optional.of(RateLimitAction.REGISTER);
        }
        if (post && path.contains("/auth/login")) {
            return Optional.of(RateLimitAction.LOGIN);
        }
        if (post && (path.contains("/auth/password-reset") || path.contains("/auth/forgot-password"))) {
            return Optional.of(RateLimitAction.PASSWORD_RESET);
        }
        if (post && path.contains("/promo-codes/validate")) {
            return Optional.of(RateLimitAction.PROMO_VALIDATE);
        }
        if (post && path.contains("/listings")) {
            return Optional.of(RateLimitAction.LISTING);
        }
        if (post && path.contains("/contact")) {
            return Optional.of(RateLimitAction.CONTACT);
        }
        if (post && path.contains("/messages")) {
            return Optional.of(RateLimitAction.MESSAGES);
        }
        if (get && (path.contains("/search") || path.contains("/discovery/"))) {
            return Optional.of(RateLimitAction.SEARCH);
        }
        return Optional.empty();
    }

    public static RateIdentity resolveIdentity(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        return new RateIdentity(resolveClientIp(request), principal != null ? principal.getName() : null);
    }

    public static boolean isVerified(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(VERIFIED_ATTRIBUTE));
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
