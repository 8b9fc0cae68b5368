package com.vcc.admission.model;

import com.vcc.admission.config.AdmissionConfigurationException;

import java.util.Locale;

/**
 * Subscription tiers known to the plan/limit table.
 */
public enum PlanTier {
    FREE("free"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String code;

    PlanTier(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parse a configured tier name.
     *
     * @throws AdmissionConfigurationException if the tier is unknown
     */
    public static PlanTier fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (PlanTier tier : values()) {
                if (tier.code.equals(normalized)) {
                    return tier;
                }
            }
        }
        throw new AdmissionConfigurationException("Unknown plan tier: " + code);
    }
}
