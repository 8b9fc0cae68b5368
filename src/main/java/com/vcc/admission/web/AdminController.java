package com.vcc.admission.web;

import com.vcc.admission.dto.AuditLogResponse;
import com.vcc.admission.dto.PlanChangedRequest;
import com.vcc.admission.dto.ResetQuotaResponse;
import com.vcc.admission.dto.ViolationResponse;
import com.vcc.admission.dto.WindowStandingResponse;
import com.vcc.admission.event.PlanChangedEvent;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.ResourceType;
import com.vcc.admission.model.UsageView;
import com.vcc.admission.model.ViolatorSummary;
import com.vcc.admission.service.AuditService;
import com.vcc.admission.service.PlanLimitTable;
import com.vcc.admission.service.QuotaResolver;
import com.vcc.admission.service.ViolationRecorder;
import com.vcc.admission.service.WindowCounter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin API for violation analytics, quota standing and operator actions.
 * Protected by AdminSecurityFilter via X-Admin-Api-Key header.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final ViolationRecorder violationRecorder;
    private final QuotaResolver quotaResolver;
    private final WindowCounter windowCounter;
    private final PlanLimitTable planLimitTable;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public AdminController(ViolationRecorder violationRecorder,
                           QuotaResolver quotaResolver,
                           WindowCounter windowCounter,
                           PlanLimitTable planLimitTable,
                           AuditService auditService,
                           ApplicationEventPublisher eventPublisher,
                           Clock clock) {
        this.violationRecorder = violationRecorder;
        this.quotaResolver = quotaResolver;
        this.windowCounter = windowCounter;
        this.planLimitTable = planLimitTable;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // ==================== Violation Endpoints ====================

    /**
     * Search violations. Defaults to the last day.
     * GET /admin/violations?subject=&scope=&from=&to=&limit=
     */
    @GetMapping("/violations")
    public Flux<ViolationResponse> searchViolations(
            @RequestParam(required = false) String subject,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "100") int limit
    ) {
        LayerScope layerScope = scope != null && !scope.isBlank() ? LayerScope.fromCode(scope) : null;
        if (from != null && to != null && from.isAfter(to)) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "from must not be after to"));
        }
        return violationRecorder.search(subject, layerScope, from, to, limit)
                .map(ViolationResponse::from);
    }

    /**
     * Subjects with the most violations.
     * GET /admin/violations/top?hours=168&limit=20
     */
    @GetMapping("/violations/top")
    public Flux<ViolatorSummary> topViolators(
            @RequestParam(defaultValue = "168") int hours,
            @RequestParam(defaultValue = "20") int limit
    ) {
        if (hours < 1) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "hours must be at least 1"));
        }
        return violationRecorder.topViolators(Duration.ofHours(hours), limit);
    }

    /**
     * All violations for one subject (IP, user ID or organization ID).
     * GET /admin/violations/{subject}
     */
    @GetMapping("/violations/{subject}")
    public Flux<ViolationResponse> violationsFor(@PathVariable String subject) {
        return violationRecorder.violationsFor(subject)
                .map(ViolationResponse::from);
    }

    // ==================== Usage Endpoints ====================

    /**
     * Quota standing of one organization across resource types.
     * GET /admin/organizations/{orgId}/usage
     */
    @GetMapping("/organizations/{orgId}/usage")
    public Flux<UsageView> organizationUsage(@PathVariable String orgId) {
        return quotaResolver.usageFor(orgId);
    }

    /**
     * Current-period usage of all organizations for one resource.
     * GET /admin/usage?resourceType=calculations
     */
    @GetMapping("/usage")
    public Flux<UsageView> listUsage(@RequestParam(defaultValue = "calculations") String resourceType) {
        return quotaResolver.listUsage(ResourceType.fromCode(resourceType));
    }

    /**
     * Current window of an IP or identity subject.
     * GET /admin/windows/{scope}/{subject}
     */
    @GetMapping("/windows/{scope}/{subject}")
    public Mono<ResponseEntity<WindowStandingResponse>> windowStanding(
            @PathVariable String scope,
            @PathVariable String subject
    ) {
        LayerScope layerScope = LayerScope.fromCode(scope);
        if (layerScope == LayerScope.ORGANIZATION) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Organizations have no window; use /admin/organizations/{orgId}/usage"));
        }
        return windowCounter.find(layerScope, subject)
                .map(window -> ResponseEntity.ok(WindowStandingResponse.from(window, clock.instant())))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No window for " + layerScope.code() + " " + subject)));
    }

    // ==================== Operator Actions ====================

    /**
     * Zero the current period of one organization quota.
     * POST /admin/organizations/{orgId}/quota/{resourceType}/reset
     */
    @PostMapping("/organizations/{orgId}/quota/{resourceType}/reset")
    public Mono<ResponseEntity<ResetQuotaResponse>> resetQuota(
            @PathVariable String orgId,
            @PathVariable String resourceType,
            ServerWebExchange exchange
    ) {
        ResourceType type = ResourceType.fromCode(resourceType);
        String actor = getAdminActor(exchange);
        String clientIp = ClientIpResolver.resolve(exchange.getRequest());

        return quotaResolver.resetCurrentPeriod(orgId, type, actor)
                .flatMap(reset ->
                        auditService.logQuotaReset(
                                        actor,
                                        orgId,
                                        type.code(),
                                        reset.periodStart(),
                                        reset.previousUsed(),
                                        clientIp
                                )
                                .thenReturn(reset)
                )
                .map(reset -> ResponseEntity.ok(ResetQuotaResponse.from(reset, actor)))
                .doOnSuccess(r -> log.info("Reset {} quota for organization {} by {}",
                        type.code(), orgId, actor));
    }

    /**
     * Re-read plan limits and swap the table.
     * POST /admin/plans/reload
     */
    @PostMapping("/plans/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reloadPlans(ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = ClientIpResolver.resolve(exchange.getRequest());

        return Mono.fromCallable(planLimitTable::reload)
                .flatMap(count ->
                        auditService.logPlanLimitsReloaded(actor, count, clientIp)
                                .thenReturn(count)
                )
                .map(count -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("status", "success");
                    result.put("entryCount", count);
                    result.put("limits", planLimitTable.snapshot());
                    return ResponseEntity.ok(result);
                })
                .doOnSuccess(r -> log.info("Plan limits reloaded by {}", actor));
    }

    /**
     * Billing reports that an organization moved to another plan.
     * POST /admin/billing/plan-changed
     */
    @PostMapping("/billing/plan-changed")
    public Mono<ResponseEntity<Map<String, Object>>> planChanged(
            @Valid @RequestBody PlanChangedRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = ClientIpResolver.resolve(exchange.getRequest());

        return Mono.fromRunnable(() -> eventPublisher.publishEvent(
                        new PlanChangedEvent(request.organizationId(), request.plan())))
                .then(Mono.defer(() ->
                        auditService.logPlanChanged(actor, request.organizationId(), request.plan(), clientIp)))
                .map(saved -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("status", "accepted");
                    result.put("organizationId", request.organizationId());
                    result.put("plan", request.plan());
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
                });
    }

    // ==================== Audit Endpoints ====================

    /**
     * Recent admin actions, or the history of one target.
     * GET /admin/audit?limit=100 or /admin/audit?targetType=quota_usage&targetId=org-1:calculations
     */
    @GetMapping("/audit")
    public Flux<AuditLogResponse> auditLog(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String targetType,
            @RequestParam(required = false) String targetId
    ) {
        if (targetType != null && targetId != null) {
            return auditService.getLogsForTarget(targetType, targetId)
                    .map(AuditLogResponse::from);
        }
        return auditService.getRecentLogs(Math.max(1, limit))
                .map(AuditLogResponse::from);
    }

    // ==================== Helper Methods ====================

    /**
     * Get admin actor from exchange attribute (set by AdminSecurityFilter).
     */
    private String getAdminActor(ServerWebExchange exchange) {
        Object actor = exchange.getAttribute(AdmissionAttributes.ADMIN_ACTOR);
        return actor != null ? actor.toString() : "unknown";
    }
}
