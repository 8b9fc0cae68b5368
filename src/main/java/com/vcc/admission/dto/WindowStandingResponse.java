package com.vcc.admission.dto;

import com.vcc.admission.model.RateWindow;

import java.time.Instant;

/**
 * Current fixed window of one subject. {@code active} is false once the window has ended,
 * in which case the next attempt starts a fresh count.
 */
public record WindowStandingResponse(
        String scope,
        String subject,
        Instant windowStart,
        Instant windowEnd,
        long windowSeconds,
        long count,
        long limit,
        long remaining,
        boolean active
) {

    public static WindowStandingResponse from(RateWindow window, Instant now) {
        boolean active = now.isBefore(window.windowEnd());
        long count = active ? window.count() : 0;
        return new WindowStandingResponse(
                window.key().scope().code(),
                window.key().subject(),
                window.windowStart(),
                window.windowEnd(),
                window.windowSize().getSeconds(),
                count,
                window.limit(),
                Math.max(0, window.limit() - count),
                active
        );
    }
}
