package com.vcc.admission.dto;

import com.vcc.admission.entity.ViolationEntity;

import java.time.Instant;

public record ViolationResponse(
        Long id,
        String subject,
        String scope,
        String violationType,
        long limit,
        long observed,
        String endpoint,
        String userAgent,
        Instant createdAt
) {

    public static ViolationResponse from(ViolationEntity entity) {
        return new ViolationResponse(
                entity.getId(),
                entity.getSubject(),
                entity.getScope(),
                entity.getViolationType(),
                entity.getLimitValue(),
                entity.getObservedCount(),
                entity.getEndpoint(),
                entity.getUserAgent(),
                entity.getCreatedAt()
        );
    }
}
