package com.vcc.admission.model;

import java.util.Locale;

/**
 * Enforcement layers, in evaluation order.
 */
public enum LayerScope {
    IP("ip", "ip_rate"),
    IDENTITY("user", "user_rate"),
    ORGANIZATION("organization", "quota");

    private final String code;
    private final String violationType;

    LayerScope(String code, String violationType) {
        this.code = code;
        this.violationType = violationType;
    }

    public String code() {
        return code;
    }

    public String violationType() {
        return violationType;
    }

    public static LayerScope fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Scope is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (LayerScope scope : values()) {
            if (scope.code.equals(normalized) || scope.name().equalsIgnoreCase(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope: " + code);
    }
}
