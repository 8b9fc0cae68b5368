package com.vcc.admission.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one check-and-increment against a window counter.
 *
 * @param degraded true when the store did not answer and the failure policy decided
 */
public record WindowDecision(
        boolean allowed,
        long currentCount,
        long limit,
        Duration resetAfter,
        Instant resetAt,
        boolean degraded
) {

    public long remaining() {
        return Math.max(0, limit - currentCount);
    }

    /**
     * Whole seconds until the window resets, at least one.
     */
    public long retryAfterSeconds() {
        long millis = resetAfter.toMillis();
        long seconds = (millis + 999) / 1000;
        return Math.max(1, seconds);
    }
}
