package com.vcc.admission.model;

/**
 * Organization quota a request draws on.
 */
public record OrganizationTarget(String organizationId, ResourceType resourceType) {
}
