package com.vcc.admission.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of one fixed window counter. A new window supersedes the row instead of
 * mutating it.
 */
public record RateWindow(
        WindowKey key,
        Instant windowStart,
        Duration windowSize,
        long count,
        long limit
) {

    public Instant windowEnd() {
        return windowStart.plus(windowSize);
    }

    public RateWindow increment() {
        return new RateWindow(key, windowStart, windowSize, count + 1, limit);
    }
}
