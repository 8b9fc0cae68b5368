package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.QuotaLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Identity-layer limits per role. Roles without an entry get the default role's limit.
 */
@Component
public class RoleLimitTable {
    private static final Logger log = LoggerFactory.getLogger(RoleLimitTable.class);

    private final Map<String, QuotaLimit> limits;
    private final QuotaLimit defaultLimit;

    public RoleLimitTable(AdmissionProperties properties) {
        AdmissionProperties.IdentityConfig identity = properties.getIdentity();
        Map<String, String> raw = identity.getRoleLimits();
        if (raw == null || raw.isEmpty()) {
            throw new AdmissionConfigurationException("No role limits configured");
        }

        Map<String, QuotaLimit> parsed = new HashMap<>();
        raw.forEach((role, value) -> {
            try {
                parsed.put(normalize(role), QuotaLimit.parse(value));
            } catch (AdmissionConfigurationException e) {
                throw new AdmissionConfigurationException("Invalid limit for role " + role + ": " + e.getMessage(), e);
            }
        });

        String defaultRole = normalize(identity.getDefaultRole());
        QuotaLimit fallback = parsed.get(defaultRole);
        if (fallback == null) {
            throw new AdmissionConfigurationException("Default role " + defaultRole + " has no configured limit");
        }
        this.limits = Map.copyOf(parsed);
        this.defaultLimit = fallback;
        log.info("RoleLimitTable loaded: {} (default role={})", limits, defaultRole);
    }

    public QuotaLimit limitFor(String role) {
        if (role == null) {
            return defaultLimit;
        }
        return limits.getOrDefault(normalize(role), defaultLimit);
    }

    private static String normalize(String role) {
        return role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
    }
}
