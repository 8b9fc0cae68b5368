package com.vcc.admission.model;

import com.vcc.admission.config.AdmissionConfigurationException;

import java.util.Locale;

/**
 * A numeric limit or the explicit unlimited sentinel. Unlimited is never encoded as a
 * large number or as zero.
 */
public record QuotaLimit(boolean unlimited, long value) {

    public static final String UNLIMITED_TOKEN = "unlimited";

    private static final QuotaLimit UNLIMITED = new QuotaLimit(true, 0L);

    public QuotaLimit {
        if (!unlimited && value < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + value);
        }
    }

    public static QuotaLimit unlimitedLimit() {
        return UNLIMITED;
    }

    public static QuotaLimit of(long value) {
        return new QuotaLimit(false, value);
    }

    /**
     * Parse a configured limit: a non-negative integer or {@code unlimited}.
     *
     * @throws AdmissionConfigurationException if the value is neither
     */
    public static QuotaLimit parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AdmissionConfigurationException("Limit value is missing");
        }
        String trimmed = raw.trim();
        if (UNLIMITED_TOKEN.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return UNLIMITED;
        }
        try {
            long parsed = Long.parseLong(trimmed);
            if (parsed < 0) {
                throw new AdmissionConfigurationException("Limit cannot be negative: " + raw);
            }
            return of(parsed);
        } catch (NumberFormatException e) {
            throw new AdmissionConfigurationException("Invalid limit value: " + raw, e);
        }
    }

    @Override
    public String toString() {
        return unlimited ? UNLIMITED_TOKEN : Long.toString(value);
    }
}
