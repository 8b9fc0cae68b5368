package com.vcc.admission.service;

import com.vcc.admission.entity.ViolationEntity;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.ViolatorSummary;
import com.vcc.admission.repository.ViolationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Append-only log of rejected attempts and the analytics read over it.
 * This is the only writer of violation rows; nothing updates or deletes them.
 */
@Service
public class ViolationRecorder {
    private static final Logger log = LoggerFactory.getLogger(ViolationRecorder.class);

    static final int MAX_RESULTS = 1000;

    private final ViolationRepository violationRepository;
    private final Clock clock;

    public ViolationRecorder(ViolationRepository violationRepository, Clock clock) {
        this.violationRepository = violationRepository;
        this.clock = clock;
    }

    /**
     * Append a violation without waiting for the write. A failed write is logged and
     * never reaches the caller.
     */
    public void record(String subject,
                       LayerScope scope,
                       long limit,
                       long observed,
                       String endpoint,
                       String userAgent) {
        ViolationEntity entity = new ViolationEntity();
        entity.setSubject(subject);
        entity.setScope(scope.code());
        entity.setViolationType(scope.violationType());
        entity.setLimitValue(limit);
        entity.setObservedCount(observed);
        entity.setEndpoint(truncate(endpoint, 255));
        entity.setUserAgent(truncate(userAgent, 500));
        entity.setCreatedAt(clock.instant());

        violationRepository.save(entity)
                .subscribe(
                        saved -> log.debug("Recorded {} violation for {} ({}/{}) on {}",
                                scope.violationType(), subject, observed, limit, endpoint),
                        e -> log.error("Failed to record violation for {} {}: {}",
                                scope.code(), subject, e.getMessage()));
    }

    /**
     * Subjects with the most violations in the trailing window, most first.
     */
    public Flux<ViolatorSummary> topViolators(Duration window, int limit) {
        Instant since = clock.instant().minus(window);
        return violationRepository.findTopViolators(since, clampLimit(limit));
    }

    /**
     * All violations recorded for a subject, newest first.
     */
    public Flux<ViolationEntity> violationsFor(String subject) {
        return violationRepository.findBySubjectOrderByCreatedAtDesc(subject);
    }

    /**
     * Filtered listing; null filters match everything.
     */
    public Flux<ViolationEntity> search(String subject, LayerScope scope, Instant from, Instant to, int limit) {
        Instant effectiveTo = to != null ? to : clock.instant();
        Instant effectiveFrom = from != null ? from : effectiveTo.minus(Duration.ofDays(1));
        return violationRepository.search(
                subject,
                scope != null ? scope.code() : null,
                effectiveFrom,
                effectiveTo,
                clampLimit(limit));
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_RESULTS));
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
