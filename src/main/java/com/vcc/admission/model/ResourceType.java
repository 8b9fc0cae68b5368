package com.vcc.admission.model;

import com.vcc.admission.config.AdmissionConfigurationException;

import java.util.Locale;

/**
 * Resources metered per calendar month against an organization's plan.
 */
public enum ResourceType {
    CALCULATIONS("calculations"),
    COMPARISONS("comparisons");

    private final String code;

    ResourceType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parse a configured resource name.
     *
     * @throws AdmissionConfigurationException if the resource is unknown
     */
    public static ResourceType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ResourceType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new AdmissionConfigurationException("Unknown resource type: " + code);
    }
}
