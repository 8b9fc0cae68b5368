package com.vcc.admission.event;

/**
 * Billing moved an organization to another plan. Cached plan lookups for the
 * organization must be dropped.
 */
public record PlanChangedEvent(String organizationId, String plan) {
}
