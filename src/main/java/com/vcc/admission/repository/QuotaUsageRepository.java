package com.vcc.admission.repository;

import com.vcc.admission.entity.QuotaUsageEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;

@Repository
public interface QuotaUsageRepository extends ReactiveCrudRepository<QuotaUsageEntity, Long> {

    Mono<QuotaUsageEntity> findByOrganizationIdAndResourceTypeAndPeriodStart(
            String organizationId, String resourceType, LocalDate periodStart);

    @Query("SELECT * FROM quota_usage WHERE period_start = :periodStart AND resource_type = :resourceType ORDER BY used DESC")
    Flux<QuotaUsageEntity> findByPeriod(LocalDate periodStart, String resourceType);

    /**
     * Create the period row or add to it in one statement.
     */
    @Modifying
    @Query("INSERT INTO quota_usage (organization_id, resource_type, period_start, used, reset_count, created_at, updated_at) "
            + "VALUES (:organizationId, :resourceType, :periodStart, :units, 0, :now, :now) "
            + "ON DUPLICATE KEY UPDATE used = used + :units, updated_at = :now")
    Mono<Integer> incrementUsage(String organizationId, String resourceType, LocalDate periodStart, long units, Instant now);

    /**
     * Create an empty period row unless one exists.
     */
    @Modifying
    @Query("INSERT IGNORE INTO quota_usage (organization_id, resource_type, period_start, used, reset_count, created_at, updated_at) "
            + "VALUES (:organizationId, :resourceType, :periodStart, 0, 0, :now, :now)")
    Mono<Integer> ensurePeriodRow(String organizationId, String resourceType, LocalDate periodStart, Instant now);

    /**
     * Add units only while the row stays within {@code limit}. The guard and the write are
     * one statement, so concurrent reservations never push {@code used} past the limit.
     *
     * @return 1 when reserved, 0 when the limit would be exceeded
     */
    @Modifying
    @Query("UPDATE quota_usage SET used = used + :units, updated_at = :now "
            + "WHERE organization_id = :organizationId AND resource_type = :resourceType AND period_start = :periodStart "
            + "AND used + :units <= :limit")
    Mono<Integer> reserveUnits(String organizationId, String resourceType, LocalDate periodStart,
                               long units, long limit, Instant now);

    /**
     * Give back reserved units that were never consumed. Never goes below zero, which
     * covers a reset landing between reservation and release.
     */
    @Modifying
    @Query("UPDATE quota_usage SET used = CASE WHEN used > :units THEN used - :units ELSE 0 END, updated_at = :now "
            + "WHERE organization_id = :organizationId AND resource_type = :resourceType AND period_start = :periodStart")
    Mono<Integer> releaseUnits(String organizationId, String resourceType, LocalDate periodStart, long units, Instant now);

    /**
     * Zero one period row. Other periods are never touched.
     */
    @Modifying
    @Query("UPDATE quota_usage SET used = 0, reset_count = reset_count + 1, last_reset_at = :now, "
            + "last_reset_by = :actor, updated_at = :now "
            + "WHERE organization_id = :organizationId AND resource_type = :resourceType AND period_start = :periodStart")
    Mono<Integer> resetPeriod(String organizationId, String resourceType, LocalDate periodStart, String actor, Instant now);
}
