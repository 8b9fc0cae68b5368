package com.vcc.admission.model;

/**
 * A subject's standing against one limit. WARNING_ZONE is informational only.
 */
public enum Standing {
    UNDER_LIMIT,
    WARNING_ZONE,
    BLOCKED
}
