package com.vcc.admission.model;

import java.time.LocalDate;

/**
 * Result of an administrative reset of one quota period.
 *
 * @param previousUsed usage the period held before it was zeroed
 * @param usage        standing after the reset
 */
public record QuotaReset(
        String organizationId,
        ResourceType resourceType,
        LocalDate periodStart,
        long previousUsed,
        UsageView usage
) {
}
