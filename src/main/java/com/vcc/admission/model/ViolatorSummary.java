package com.vcc.admission.model;

import java.time.Instant;

/**
 * Aggregated violation count for one subject.
 */
public record ViolatorSummary(
        String subject,
        String scope,
        Long violationCount,
        Instant lastSeen
) {
}
