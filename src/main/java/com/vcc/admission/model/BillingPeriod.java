package com.vcc.admission.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Calendar-month quota period, in UTC.
 */
public record BillingPeriod(LocalDate start) {

    public static BillingPeriod containing(Instant instant) {
        LocalDate date = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return new BillingPeriod(date.withDayOfMonth(1));
    }

    public LocalDate nextStart() {
        return start.plusMonths(1);
    }

    public Instant endsAt() {
        return nextStart().atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Whole days until the period boundary, rounded down.
     */
    public int daysUntilReset(Instant now) {
        long days = ChronoUnit.DAYS.between(now, endsAt());
        return (int) Math.max(0, days);
    }
}
