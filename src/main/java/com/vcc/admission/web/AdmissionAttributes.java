package com.vcc.admission.web;

/**
 * Exchange attributes shared with the identity provider and business handlers.
 */
public final class AdmissionAttributes {

    /**
     * {@link com.vcc.admission.model.VerifiedPrincipal} set by the identity provider's filter,
     * which must run before {@link AdmissionWebFilter}.
     */
    public static final String PRINCIPAL = "admission.principal";

    /**
     * Billable units a handler consumed, as a {@link Number}. Absent means one unit.
     */
    public static final String BILLABLE_UNITS = "admission.billableUnits";

    /**
     * Actor set by {@link AdminSecurityFilter} for audit records.
     */
    public static final String ADMIN_ACTOR = "adminActor";

    private AdmissionAttributes() {
    }
}
