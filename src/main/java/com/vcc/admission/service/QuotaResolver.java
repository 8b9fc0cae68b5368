package com.vcc.admission.service;

import com.vcc.admission.entity.QuotaUsageEntity;
import com.vcc.admission.event.QuotaStandingChangedEvent;
import com.vcc.admission.model.BillingPeriod;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.QuotaReservation;
import com.vcc.admission.model.QuotaReset;
import com.vcc.admission.model.ResourceType;
import com.vcc.admission.model.UsageView;
import com.vcc.admission.repository.QuotaUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

/**
 * Organization quota standing per resource type for the current calendar month.
 *
 * <p>The only writer of quota usage rows. Limits are never stored with usage; they are
 * joined from the {@link PlanLimitTable} on every read, so a plan change applies to the
 * running period immediately.
 */
@Service
public class QuotaResolver {
    private static final Logger log = LoggerFactory.getLogger(QuotaResolver.class);

    private final QuotaUsageRepository usageRepository;
    private final PlanLimitTable planLimitTable;
    private final OrganizationPlanService planService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public QuotaResolver(QuotaUsageRepository usageRepository,
                         PlanLimitTable planLimitTable,
                         OrganizationPlanService planService,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock) {
        this.usageRepository = usageRepository;
        this.planLimitTable = planLimitTable;
        this.planService = planService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Current standing of an organization on one resource. An organization with no
     * usage row for this period has used nothing.
     */
    public Mono<UsageView> resolve(String organizationId, ResourceType resourceType) {
        Instant now = clock.instant();
        BillingPeriod period = BillingPeriod.containing(now);
        return planService.resolvePlan(organizationId)
                .flatMap(plan -> currentUsed(organizationId, resourceType, period)
                        .map(used -> toView(organizationId, resourceType, plan, used, period, now)));
    }

    /**
     * Take units from the current period before the request runs. The limit check and the
     * increment are a single conditional update, so concurrent reservations against the
     * same organization admit at most {@code limit - used} of them. Unlimited resources
     * are always granted and simply counted.
     */
    public Mono<QuotaReservation> reserve(String organizationId, ResourceType resourceType, long units) {
        Instant now = clock.instant();
        BillingPeriod period = BillingPeriod.containing(now);
        String resource = resourceType.code();
        return planService.resolvePlan(organizationId)
                .flatMap(plan -> {
                    QuotaLimit limit = planLimitTable.limitFor(plan, resourceType);
                    Mono<Integer> write = limit.unlimited()
                            ? usageRepository.incrementUsage(organizationId, resource, period.start(), units, now)
                            : usageRepository.ensurePeriodRow(organizationId, resource, period.start(), now)
                                    .then(usageRepository.reserveUnits(
                                            organizationId, resource, period.start(), units, limit.value(), now));
                    return write.defaultIfEmpty(0)
                            .flatMap(rows -> currentUsed(organizationId, resourceType, period)
                                    .map(used -> {
                                        boolean granted = limit.unlimited() || rows > 0;
                                        UsageView after = toView(organizationId, resourceType, plan, used, period, now);
                                        if (granted) {
                                            publishIfChanged(
                                                    toView(organizationId, resourceType, plan, used - units, period, now),
                                                    after);
                                        }
                                        return new QuotaReservation(organizationId, resourceType, period.start(),
                                                granted ? units : 0, granted, after);
                                    }));
                });
    }

    /**
     * Return reserved units the request did not consume, against the period they were
     * taken from.
     */
    public Mono<UsageView> release(QuotaReservation reservation, long units) {
        String organizationId = reservation.organizationId();
        ResourceType resourceType = reservation.resourceType();
        if (units <= 0 || !reservation.granted()) {
            return resolve(organizationId, resourceType);
        }
        return resolve(organizationId, resourceType)
                .flatMap(before -> usageRepository.releaseUnits(organizationId, resourceType.code(),
                                reservation.periodStart(), units, clock.instant())
                        .then(resolve(organizationId, resourceType))
                        .doOnNext(after -> {
                            log.debug("Released {} {} for organization {} ({}/{})", units, resourceType.code(),
                                    organizationId, after.used(), after.unlimited() ? "unlimited" : after.limit());
                            publishIfChanged(before, after);
                        }));
    }

    /**
     * Meter billable units beyond what was reserved, after business logic succeeded. The
     * row for the period is created or incremented in one statement. The work is already
     * done, so this is not limit-checked.
     */
    public Mono<UsageView> consume(String organizationId, ResourceType resourceType, long units) {
        if (units <= 0) {
            return resolve(organizationId, resourceType);
        }
        return resolve(organizationId, resourceType)
                .flatMap(before -> usageRepository.incrementUsage(
                                organizationId, resourceType.code(), before.periodStart(), units, clock.instant())
                        .then(resolve(organizationId, resourceType))
                        .doOnNext(after -> {
                            log.debug("Metered {} {} for organization {} ({}/{})", units, resourceType.code(),
                                    organizationId, after.used(), after.unlimited() ? "unlimited" : after.limit());
                            publishIfChanged(before, after);
                        }));
    }

    /**
     * Zero the current period only. Earlier periods and the violation log are untouched.
     */
    public Mono<QuotaReset> resetCurrentPeriod(String organizationId, ResourceType resourceType, String actor) {
        BillingPeriod period = BillingPeriod.containing(clock.instant());
        return resolve(organizationId, resourceType)
                .flatMap(before -> usageRepository.resetPeriod(
                                organizationId, resourceType.code(), period.start(), actor, clock.instant())
                        .doOnNext(rows -> {
                            if (rows == 0) {
                                log.info("No {} usage to reset for organization {} in period {}",
                                        resourceType.code(), organizationId, period.start());
                            }
                        })
                        .then(resolve(organizationId, resourceType))
                        .map(after -> {
                            log.info("Reset {} quota for organization {} (period {}, previous used {}) by {}",
                                    resourceType.code(), organizationId, period.start(), before.used(), actor);
                            publishIfChanged(before, after);
                            return new QuotaReset(organizationId, resourceType, period.start(), before.used(), after);
                        }));
    }

    /**
     * Usage of every organization with a row for the current period, highest first.
     */
    public Flux<UsageView> listUsage(ResourceType resourceType) {
        Instant now = clock.instant();
        BillingPeriod period = BillingPeriod.containing(now);
        return usageRepository.findByPeriod(period.start(), resourceType.code())
                .concatMap(row -> planService.resolvePlan(row.getOrganizationId())
                        .map(plan -> toView(row.getOrganizationId(), resourceType, plan, row.getUsed(), period, now)));
    }

    /**
     * Standing of one organization across all resource types.
     */
    public Flux<UsageView> usageFor(String organizationId) {
        return Flux.fromIterable(Arrays.asList(ResourceType.values()))
                .concatMap(resourceType -> resolve(organizationId, resourceType));
    }

    private Mono<Long> currentUsed(String organizationId, ResourceType resourceType, BillingPeriod period) {
        return usageRepository.findByOrganizationIdAndResourceTypeAndPeriodStart(
                        organizationId, resourceType.code(), period.start())
                .map(QuotaUsageEntity::getUsed)
                .defaultIfEmpty(0L);
    }

    private UsageView toView(String organizationId, ResourceType resourceType, PlanTier plan,
                             long used, BillingPeriod period, Instant now) {
        return UsageView.of(organizationId, resourceType, plan, used,
                planLimitTable.limitFor(plan, resourceType), period, now);
    }

    private void publishIfChanged(UsageView before, UsageView after) {
        if (before.standing() != after.standing()) {
            log.info("Organization {} {} standing changed {} -> {}", after.organizationId(),
                    after.resourceType().code(), before.standing(), after.standing());
            eventPublisher.publishEvent(new QuotaStandingChangedEvent(before.standing(), after.standing(), after));
        }
    }
}
