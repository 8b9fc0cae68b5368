package com.vcc.admission.model;

/**
 * Principal verified by the identity provider before admission runs.
 *
 * @param organizationId organization the principal acts for, null for individual accounts
 */
public record VerifiedPrincipal(String id, String role, String organizationId) {

    public boolean hasOrganization() {
        return organizationId != null && !organizationId.isBlank();
    }
}
