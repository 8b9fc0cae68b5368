package com.vcc.admission.model;

import java.time.Instant;

/**
 * Diagnostics for one evaluated layer.
 *
 * @param limit   null when the layer is unlimited for this subject
 * @param resetAt end of the window or quota period
 */
public record LayerOutcome(
        LayerScope scope,
        String subject,
        boolean allowed,
        Long limit,
        long used,
        Instant resetAt,
        boolean degraded
) {

    public long remaining() {
        if (limit == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, limit - used);
    }
}
