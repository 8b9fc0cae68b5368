package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.entity.OrganizationEntity;
import com.vcc.admission.event.PlanChangedEvent;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.repository.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves an organization's current plan tier.
 *
 * Lookup chain:
 * 1. Redis cache (short TTL)
 * 2. Organization record (plan column maintained by billing)
 * 3. Cache result
 *
 * Plan changes published as {@link PlanChangedEvent} drop the cached entry, so a stale
 * plan survives at most one lookup that was already in flight.
 */
@Service
public class OrganizationPlanService {
    private static final Logger log = LoggerFactory.getLogger(OrganizationPlanService.class);

    static final PlanTier FALLBACK_PLAN = PlanTier.FREE;

    private final OrganizationRepository organizationRepository;
    private final CacheService cacheService;

    public OrganizationPlanService(OrganizationRepository organizationRepository,
                                   CacheService cacheService) {
        this.organizationRepository = organizationRepository;
        this.cacheService = cacheService;
    }

    public Mono<PlanTier> resolvePlan(String organizationId) {
        return cacheService.getOrganizationPlan(organizationId)
                .switchIfEmpty(Mono.defer(() -> lookupFromDbAndCache(organizationId)))
                .map(plan -> toTier(organizationId, plan))
                .defaultIfEmpty(FALLBACK_PLAN);
    }

    private Mono<String> lookupFromDbAndCache(String organizationId) {
        return organizationRepository.findById(organizationId)
                .map(OrganizationEntity::getPlan)
                .flatMap(plan -> cacheService.cacheOrganizationPlan(organizationId, plan).thenReturn(plan))
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.warn("Organization {} not found, applying {} plan limits",
                                organizationId, FALLBACK_PLAN.code())));
    }

    private PlanTier toTier(String organizationId, String plan) {
        try {
            return PlanTier.fromCode(plan);
        } catch (AdmissionConfigurationException e) {
            log.error("Organization {} has unknown plan '{}', applying {} plan limits",
                    organizationId, plan, FALLBACK_PLAN.code());
            return FALLBACK_PLAN;
        }
    }

    @EventListener
    public void onPlanChanged(PlanChangedEvent event) {
        log.info("Plan changed for organization {} to {}", event.organizationId(), event.plan());
        cacheService.invalidateOrganizationPlan(event.organizationId())
                .subscribe(
                        deleted -> log.debug("Dropped cached plan for {} (deleted={})", event.organizationId(), deleted),
                        e -> log.error("Failed to drop cached plan for {}: {}", event.organizationId(), e.getMessage()));
    }
}
