package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Immutable (plan tier x resource type) limit table. Built once at startup, which fails
 * on an unknown tier, an unknown resource or a missing combination, and swapped
 * atomically on {@link #reload()}.
 */
@Component
public class PlanLimitTable {
    private static final Logger log = LoggerFactory.getLogger(PlanLimitTable.class);

    private final PlanLimitProvider provider;
    private final AtomicReference<Map<PlanTier, Map<ResourceType, QuotaLimit>>> limitsRef;

    public PlanLimitTable(PlanLimitProvider provider) {
        this.provider = provider;
        this.limitsRef = new AtomicReference<>(build(provider.loadPlanLimits()));
        log.info("PlanLimitTable loaded: {}", limitsRef.get());
    }

    public QuotaLimit limitFor(PlanTier plan, ResourceType resourceType) {
        return limitsRef.get().get(plan).get(resourceType);
    }

    public Map<PlanTier, Map<ResourceType, QuotaLimit>> snapshot() {
        return limitsRef.get();
    }

    /**
     * Re-read the provider and swap the table. A table that fails validation is
     * rejected and the current one stays in place.
     *
     * @return number of (plan, resource) entries now active
     * @throws AdmissionConfigurationException if the new data is invalid
     */
    public int reload() {
        Map<PlanTier, Map<ResourceType, QuotaLimit>> fresh = build(provider.loadPlanLimits());
        limitsRef.set(fresh);
        log.info("PlanLimitTable reloaded: {}", fresh);
        return PlanTier.values().length * ResourceType.values().length;
    }

    static Map<PlanTier, Map<ResourceType, QuotaLimit>> build(Map<String, Map<String, String>> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new AdmissionConfigurationException("No plan limits configured");
        }

        Map<PlanTier, Map<ResourceType, QuotaLimit>> table = new EnumMap<>(PlanTier.class);
        raw.forEach((planName, resources) -> {
            PlanTier plan = PlanTier.fromCode(planName);
            Map<ResourceType, QuotaLimit> limits = new EnumMap<>(ResourceType.class);
            if (resources != null) {
                resources.forEach((resourceName, value) -> {
                    ResourceType resourceType = ResourceType.fromCode(resourceName);
                    try {
                        limits.put(resourceType, QuotaLimit.parse(value));
                    } catch (AdmissionConfigurationException e) {
                        throw new AdmissionConfigurationException(
                                "Invalid limit for " + plan.code() + "/" + resourceType.code() + ": " + e.getMessage(), e);
                    }
                });
            }
            table.put(plan, limits);
        });

        for (PlanTier plan : PlanTier.values()) {
            Map<ResourceType, QuotaLimit> limits = table.get(plan);
            if (limits == null) {
                throw new AdmissionConfigurationException("No limits configured for plan " + plan.code());
            }
            for (ResourceType resourceType : ResourceType.values()) {
                if (!limits.containsKey(resourceType)) {
                    throw new AdmissionConfigurationException(
                            "No limit configured for plan " + plan.code() + " and resource " + resourceType.code());
                }
            }
            table.put(plan, Collections.unmodifiableMap(limits));
        }
        return Collections.unmodifiableMap(table);
    }
}
