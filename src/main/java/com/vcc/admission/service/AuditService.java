package com.vcc.admission.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.admission.entity.AdminAuditLogEntity;
import com.vcc.admission.repository.AdminAuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit logging service for admin operations.
 * Organic period rollovers never write here, so an administrative quota reset is always
 * distinguishable by its own {@link #ACTION_RESET_QUOTA} record.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    // Standard action types
    public static final String ACTION_RESET_QUOTA = "RESET_QUOTA";
    public static final String ACTION_RELOAD_PLAN_LIMITS = "RELOAD_PLAN_LIMITS";
    public static final String ACTION_PLAN_CHANGED = "PLAN_CHANGED";

    // Target types
    public static final String TARGET_QUOTA_USAGE = "quota_usage";
    public static final String TARGET_PLAN_TABLE = "plan_table";
    public static final String TARGET_ORGANIZATION = "organization";

    private final AdminAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(AdminAuditLogRepository auditLogRepository,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Log an admin action.
     *
     * @param actor      The admin user performing the action
     * @param action     The action type (e.g., RESET_QUOTA)
     * @param targetType The type of target (e.g., quota_usage)
     * @param targetId   The ID of the target
     * @param details    Additional details as key-value pairs
     * @param clientIp   Client IP address
     * @return The saved audit log entry
     */
    public Mono<AdminAuditLogEntity> logAction(
            String actor,
            String action,
            String targetType,
            String targetId,
            Map<String, Object> details,
            String clientIp
    ) {
        AdminAuditLogEntity entity = new AdminAuditLogEntity();
        entity.setActor(actor != null ? actor : "unknown");
        entity.setAction(action);
        entity.setTargetType(targetType);
        entity.setTargetId(targetId);
        entity.setClientIp(clientIp);
        entity.setCreatedAt(clock.instant());

        if (details != null && !details.isEmpty()) {
            try {
                entity.setDetailJson(objectMapper.writeValueAsString(details));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize audit details: {}", e.getMessage());
                entity.setDetailJson("{}");
            }
        }

        return auditLogRepository.save(entity)
                .doOnSuccess(saved -> log.info("Audit: {} {} {} by {} from {}",
                        action, targetType, targetId, actor, clientIp))
                .doOnError(e -> log.error("Failed to save audit log: {}", e.getMessage()));
    }

    /**
     * Log an administrative quota reset.
     */
    public Mono<AdminAuditLogEntity> logQuotaReset(
            String actor,
            String organizationId,
            String resourceType,
            LocalDate periodStart,
            long previousUsed,
            String clientIp
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resourceType", resourceType);
        details.put("periodStart", periodStart.toString());
        details.put("previousUsed", previousUsed);
        details.put("kind", "administrative");
        return logAction(
                actor,
                ACTION_RESET_QUOTA,
                TARGET_QUOTA_USAGE,
                organizationId + ":" + resourceType,
                details,
                clientIp
        );
    }

    /**
     * Log a plan/limit table reload.
     */
    public Mono<AdminAuditLogEntity> logPlanLimitsReloaded(
            String actor,
            int entryCount,
            String clientIp
    ) {
        return logAction(
                actor,
                ACTION_RELOAD_PLAN_LIMITS,
                TARGET_PLAN_TABLE,
                null,
                Map.of("entryCount", entryCount),
                clientIp
        );
    }

    /**
     * Log a plan change reported by billing.
     */
    public Mono<AdminAuditLogEntity> logPlanChanged(
            String actor,
            String organizationId,
            String newPlan,
            String clientIp
    ) {
        return logAction(
                actor,
                ACTION_PLAN_CHANGED,
                TARGET_ORGANIZATION,
                organizationId,
                Map.of("plan", newPlan),
                clientIp
        );
    }

    // ==================== Query Methods ====================

    /**
     * Get recent audit logs.
     */
    public Flux<AdminAuditLogEntity> getRecentLogs(int limit) {
        return auditLogRepository.findRecent(Math.min(limit, 1000));
    }

    /**
     * Get audit logs for a specific target.
     */
    public Flux<AdminAuditLogEntity> getLogsForTarget(String targetType, String targetId) {
        return auditLogRepository.findByTargetTypeAndTargetId(targetType, targetId);
    }
}
