package com.vcc.admission;

import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.FailurePolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Properties matching the shipped application.yml.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static AdmissionProperties defaults() {
        AdmissionProperties properties = new AdmissionProperties();

        Map<String, String> roles = new LinkedHashMap<>();
        roles.put("viewer", "50");
        roles.put("user", "100");
        roles.put("admin", "500");
        roles.put("superadmin", "unlimited");
        properties.getIdentity().setRoleLimits(roles);

        AdmissionProperties.QuotaEndpoint calculations = new AdmissionProperties.QuotaEndpoint();
        calculations.setPathPrefix("/api/v1/calculations");
        calculations.setResource("calculations");
        AdmissionProperties.QuotaEndpoint comparisons = new AdmissionProperties.QuotaEndpoint();
        comparisons.setPathPrefix("/api/v1/comparisons");
        comparisons.setResource("comparisons");
        properties.getQuota().setEndpoints(List.of(calculations, comparisons));

        properties.getAdmin().setAdminApiKeys(List.of("admin-key-0123456789"));
        return properties;
    }

    public static AdmissionProperties withFailurePolicy(FailurePolicy policy) {
        AdmissionProperties properties = defaults();
        properties.getStore().setFailurePolicy(policy);
        return properties;
    }

    public static Map<String, Map<String, String>> defaultPlans() {
        Map<String, Map<String, String>> plans = new LinkedHashMap<>();
        plans.put("free", limits("100", "50"));
        plans.put("pro", limits("1000", "500"));
        plans.put("enterprise", limits("10000", "unlimited"));
        return plans;
    }

    private static Map<String, String> limits(String calculations, String comparisons) {
        Map<String, String> limits = new LinkedHashMap<>();
        limits.put("calculations", calculations);
        limits.put("comparisons", comparisons);
        return limits;
    }
}
