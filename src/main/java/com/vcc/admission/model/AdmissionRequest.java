package com.vcc.admission.model;

/**
 * Input to the admission gate.
 *
 * @param ip           client address, always present
 * @param principal    verified identity, null for anonymous requests
 * @param organization quota target, null when the endpoint is not quota-relevant
 * @param endpoint     request path, recorded with violations
 * @param userAgent    client user agent, may be null
 */
public record AdmissionRequest(
        String ip,
        VerifiedPrincipal principal,
        OrganizationTarget organization,
        String endpoint,
        String userAgent
) {

    public boolean hasPrincipal() {
        return principal != null && principal.id() != null && !principal.id().isBlank();
    }

    public boolean isQuotaRelevant() {
        return organization != null;
    }
}
