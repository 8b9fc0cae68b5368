package com.vcc.admission.repository;

import com.vcc.admission.entity.AdminAuditLogEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AdminAuditLogRepository extends ReactiveCrudRepository<AdminAuditLogEntity, Long> {

    Flux<AdminAuditLogEntity> findByTargetTypeAndTargetId(String targetType, String targetId);

    @Query("SELECT * FROM admin_audit_log ORDER BY created_at DESC LIMIT :limit")
    Flux<AdminAuditLogEntity> findRecent(int limit);
}
