package com.vcc.admission.model;

/**
 * What to decide when the counter store or the quota store cannot answer in time.
 */
public enum FailurePolicy {
    /** Admit the request and log a warning. */
    FAIL_OPEN,
    /** Reject the request with a well-formed denial and log an error. */
    FAIL_CLOSED
}
