package com.vcc.admission.repository;

import com.vcc.admission.entity.ViolationEntity;
import com.vcc.admission.model.ViolatorSummary;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

@Repository
public interface ViolationRepository extends ReactiveCrudRepository<ViolationEntity, Long> {

    Flux<ViolationEntity> findBySubjectOrderByCreatedAtDesc(String subject);

    @Query("SELECT * FROM rate_limit_violation "
            + "WHERE (:subject IS NULL OR subject = :subject) "
            + "AND (:scope IS NULL OR scope = :scope) "
            + "AND created_at >= :from AND created_at <= :to "
            + "ORDER BY created_at DESC LIMIT :limit")
    Flux<ViolationEntity> search(String subject, String scope, Instant from, Instant to, int limit);

    @Query("SELECT subject, scope, COUNT(*) AS violation_count, MAX(created_at) AS last_seen "
            + "FROM rate_limit_violation WHERE created_at >= :since "
            + "GROUP BY subject, scope ORDER BY violation_count DESC LIMIT :limit")
    Flux<ViolatorSummary> findTopViolators(Instant since, int limit);
}
