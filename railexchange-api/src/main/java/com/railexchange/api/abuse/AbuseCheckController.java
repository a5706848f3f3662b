package com.railexchange.api.abuse;

import com.railexchange.api.config.RateLimitInterceptor;
import com.railexchange.api.entitlement.EntityStore;
import com.railexchange.api.ratelimit.RateIdentity;
import com.railexchange.api.ratelimit.RateLimitResult;
import com.railexchange.core.domain.EntitySnapshot;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Admission checks run by the inquiry and report flows before anything is stored.
 * POST /api/v1/entities/{id}/inquiries/check
 * POST /api/v1/entities/{id}/reports/check
 *
 * These paths are the only place inquiries and reports are counted.
 */
@RestController
@RequestMapping("/api/v1/entities")
public class AbuseCheckController {

    private final AbusePreventionService abusePreventionService;
    private final EntityStore entityStore;

    public AbuseCheckController(AbusePreventionService abusePreventionService, EntityStore entityStore) {
        this.abusePreventionService = abusePreventionService;
        this.entityStore = entityStore;
    }

    @PostMapping("/{id}/inquiries/check")
    public ResponseEntity<AbuseCheckResponse> checkInquiry(@PathVariable UUID id,
                                                           @RequestBody InquiryRequest inquiry,
                                                           HttpServletRequest request) {
        EntitySnapshot sender = entityStore.find(id).orElse(null);
        RateIdentity identity = RateLimitInterceptor.resolveIdentity(request);
        RateLimitResult result = abusePreventionService.checkInquiry(
                identity, RateLimitInterceptor.isVerified(request), sender, inquiry == null ? null : inquiry.body());
        return toResponse(result);
    }

    @PostMapping("/{id}/reports/check")
    public ResponseEntity<AbuseCheckResponse> checkReport(@PathVariable UUID id, HttpServletRequest request) {
        EntitySnapshot reporter = entityStore.find(id).orElse(null);
        RateIdentity identity = RateLimitInterceptor.resolveIdentity(request);
        RateLimitResult result = abusePreventionService.checkReport(
                identity, RateLimitInterceptor.isVerified(request), reporter);
        return toResponse(result);
    }

    static ResponseEntity<AbuseCheckResponse> toResponse(RateLimitResult result) {
        AbuseCheckResponse body = new AbuseCheckResponse(
                result.allowed(), result.remaining(), result.outcome().name(), result.message());
        if (result.allowed()) {
            return ResponseEntity.ok(body);
        }
        HttpStatus status = switch (result.outcome()) {
            case CONTENT_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case LIMITED, LOCKED_OUT, ERROR, ALLOWED -> HttpStatus.TOO_MANY_REQUESTS;
        };
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status)
                .header("X-RateLimit-Remaining", String.valueOf(result.remaining()));
        if (result.retryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
        }
        return builder.body(body);
    }

    public record InquiryRequest(String body) {}

    public record AbuseCheckResponse(boolean allowed, int remaining, String outcome, String message) {}
}
