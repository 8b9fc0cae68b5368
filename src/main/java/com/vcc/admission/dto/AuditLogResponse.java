package com.vcc.admission.dto;

import com.vcc.admission.entity.AdminAuditLogEntity;

import java.time.Instant;

public record AuditLogResponse(
        Long id,
        String actor,
        String action,
        String targetType,
        String targetId,
        String detailJson,
        String clientIp,
        Instant createdAt
) {

    public static AuditLogResponse from(AdminAuditLogEntity entity) {
        return new AuditLogResponse(
                entity.getId(),
                entity.getActor(),
                entity.getAction(),
                entity.getTargetType(),
                entity.getTargetId(),
                entity.getDetailJson(),
                entity.getClientIp(),
                entity.getCreatedAt()
        );
    }
}
