package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.AdmissionDecision;
import com.vcc.admission.model.AdmissionRequest;
import com.vcc.admission.model.BillingPeriod;
import com.vcc.admission.model.FailurePolicy;
import com.vcc.admission.model.LayerOutcome;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.OrganizationTarget;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.UsageView;
import com.vcc.admission.model.VerifiedPrincipal;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Layered admission gate.
 *
 * Layers, in order:
 * 1. IP - every request, global per-window limit
 * 2. Identity - verified principals only, per-role limit
 * 3. Organization - quota-relevant endpoints only, monthly plan quota
 *
 * The first rejecting layer ends evaluation and records a violation. Later layers are
 * never consulted, so a request refused by IP or identity cannot touch the quota.
 * An admitted quota-relevant request holds one reserved unit; the caller settles it
 * against what business logic actually consumed.
 */
@Service
public class ThrottleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ThrottleOrchestrator.class);

    static final long RESERVED_UNITS = 1L;

    private final WindowCounter windowCounter;
    private final RoleLimitTable roleLimits;
    private final QuotaResolver quotaResolver;
    private final ViolationRecorder violationRecorder;
    private final Clock clock;
    private final Duration windowSize;
    private final long ipLimit;
    private final String upgradeUrl;
    private final Duration quotaTimeout;
    private final FailurePolicy failurePolicy;

    public ThrottleOrchestrator(WindowCounter windowCounter,
                                RoleLimitTable roleLimits,
                                QuotaResolver quotaResolver,
                                ViolationRecorder violationRecorder,
                                Clock clock,
                                AdmissionProperties properties) {
        this.windowCounter = windowCounter;
        this.roleLimits = roleLimits;
        this.quotaResolver = quotaResolver;
        this.violationRecorder = violationRecorder;
        this.clock = clock;
        this.windowSize = Duration.ofSeconds(properties.getWindowSeconds());
        this.ipLimit = properties.getIpLimit();
        this.upgradeUrl = properties.getQuota().getUpgradeUrl();
        this.quotaTimeout = Duration.ofMillis(properties.getQuota().getTimeoutMillis());
        this.failurePolicy = properties.getStore().getFailurePolicy();
    }

    public Mono<AdmissionDecision> admit(AdmissionRequest request) {
        // Layers run one after another, so the list is never touched concurrently
        List<LayerOutcome> layers = new ArrayList<>(3);
        return checkIp(request, layers)
                .switchIfEmpty(Mono.defer(() -> checkIdentity(request, layers)))
                .switchIfEmpty(Mono.defer(() -> checkOrganization(request, layers)))
                .switchIfEmpty(Mono.fromSupplier(() -> AdmissionDecision.allow(layers)));
    }

    // ==================== Layers ====================

    private Mono<AdmissionDecision> checkIp(AdmissionRequest request, List<LayerOutcome> layers) {
        String ip = request.ip();
        return windowCounter.checkAndIncrement(LayerScope.IP, ip, ipLimit, windowSize)
                .flatMap(decision -> {
                    layers.add(toOutcome(LayerScope.IP, ip, decision));
                    if (decision.allowed()) {
                        return Mono.empty();
                    }
                    String message = "Too many requests. Limit: " + ipLimit + " requests per "
                            + windowSize.getSeconds() + " seconds.";
                    return Mono.just(rejectRate(LayerScope.IP, ip, decision, message, request, layers));
                });
    }

    private Mono<AdmissionDecision> checkIdentity(AdmissionRequest request, List<LayerOutcome> layers) {
        if (!request.hasPrincipal()) {
            return Mono.empty();
        }
        VerifiedPrincipal principal = request.principal();
        QuotaLimit limit = roleLimits.limitFor(principal.role());
        if (limit.unlimited()) {
            layers.add(new LayerOutcome(LayerScope.IDENTITY, principal.id(), true, null, 0, null, false));
            return Mono.empty();
        }

        return windowCounter.checkAndIncrement(LayerScope.IDENTITY, principal.id(), limit.value(), windowSize)
                .flatMap(decision -> {
                    layers.add(toOutcome(LayerScope.IDENTITY, principal.id(), decision));
                    if (decision.allowed()) {
                        return Mono.empty();
                    }
                    String message = "Rate limit exceeded for " + principal.role() + " role. Limit: "
                            + limit.value() + " requests per " + windowSize.getSeconds() + " seconds.";
                    return Mono.just(rejectRate(LayerScope.IDENTITY, principal.id(), decision, message, request, layers));
                });
    }

    private Mono<AdmissionDecision> checkOrganization(AdmissionRequest request, List<LayerOutcome> layers) {
        if (!request.isQuotaRelevant()) {
            return Mono.empty();
        }
        OrganizationTarget target = request.organization();
        return quotaResolver.reserve(target.organizationId(), target.resourceType(), RESERVED_UNITS)
                .timeout(quotaTimeout)
                .switchIfEmpty(Mono.error(() -> new StoreUnavailableException("Quota resolver returned no usage")))
                .flatMap(reservation -> {
                    UsageView view = reservation.usage();
                    layers.add(new LayerOutcome(LayerScope.ORGANIZATION, target.organizationId(),
                            reservation.granted(), view.limit(), view.used(), view.resetAt(), false));
                    return Mono.just(reservation.granted()
                            ? AdmissionDecision.allow(layers, reservation)
                            : rejectQuota(target, view, request, layers));
                })
                .onErrorResume(e -> onQuotaFailure(target, e, layers));
    }

    // ==================== Decisions ====================

    private AdmissionDecision rejectRate(LayerScope scope,
                                         String subject,
                                         WindowDecision decision,
                                         String message,
                                         AdmissionRequest request,
                                         List<LayerOutcome> layers) {
        if (decision.degraded()) {
            return AdmissionDecision.unavailable(scope, decision.limit(), decision.retryAfterSeconds(),
                    "Request admission is temporarily unavailable. Please retry shortly.", layers);
        }

        violationRecorder.record(subject, scope, decision.limit(), decision.limit() + 1,
                request.endpoint(), request.userAgent());
        log.info("Rejected {} {} on {}: {}/{} in window", scope.code(), subject, request.endpoint(),
                decision.currentCount(), decision.limit());
        return AdmissionDecision.rateLimited(scope, decision.limit(), decision.currentCount(),
                decision.retryAfterSeconds(), AdmissionDecision.ERROR_RATE_LIMITED, message, layers);
    }

    private AdmissionDecision rejectQuota(OrganizationTarget target,
                                          UsageView view,
                                          AdmissionRequest request,
                                          List<LayerOutcome> layers) {
        String resource = target.resourceType().code();
        violationRecorder.record(target.organizationId(), LayerScope.ORGANIZATION, view.limit(), view.used() + 1,
                request.endpoint(), request.userAgent());
        log.info("Rejected organization {} on {}: {} quota {}/{} ({} plan)", target.organizationId(),
                request.endpoint(), resource, view.used(), view.limit(), view.plan().code());

        String message = "Monthly " + resource + " quota exceeded. Limit: " + view.limit() + " "
                + resource + "/month.";
        return AdmissionDecision.quotaExceeded(view.limit(), view.used(), view.resetsInDays(), upgradeUrl,
                AdmissionDecision.ERROR_QUOTA_EXCEEDED, message, layers);
    }

    private Mono<AdmissionDecision> onQuotaFailure(OrganizationTarget target, Throwable error, List<LayerOutcome> layers) {
        Instant now = clock.instant();
        Instant resetAt = BillingPeriod.containing(now).endsAt();
        layers.add(new LayerOutcome(LayerScope.ORGANIZATION, target.organizationId(),
                failurePolicy == FailurePolicy.FAIL_OPEN, null, 0, resetAt, true));

        if (failurePolicy == FailurePolicy.FAIL_OPEN) {
            log.warn("Quota lookup failed for organization {}, admitting (FAIL_OPEN): {}",
                    target.organizationId(), error.toString());
            return Mono.empty();
        }
        log.error("Quota lookup failed for organization {}, rejecting (FAIL_CLOSED): {}",
                target.organizationId(), error.toString());
        return Mono.just(AdmissionDecision.unavailable(LayerScope.ORGANIZATION, null, windowSize.getSeconds(),
                "Request admission is temporarily unavailable. Please retry shortly.", layers));
    }

    private static LayerOutcome toOutcome(LayerScope scope, String subject, WindowDecision decision) {
        return new LayerOutcome(scope, subject, decision.allowed(), decision.limit(), decision.currentCount(),
                decision.resetAt(), decision.degraded());
    }
}
