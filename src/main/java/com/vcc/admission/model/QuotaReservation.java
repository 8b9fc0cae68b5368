package com.vcc.admission.model;

import java.time.LocalDate;

/**
 * Units taken from an organization's quota at admission, before business logic runs.
 * Settled once the response is known: units the request did not consume are released
 * against the same period they were taken from.
 *
 * @param units  units held, zero when the reservation was refused
 * @param usage  standing right after the attempt
 */
public record QuotaReservation(
        String organizationId,
        ResourceType resourceType,
        LocalDate periodStart,
        long units,
        boolean granted,
        UsageView usage
) {
}
