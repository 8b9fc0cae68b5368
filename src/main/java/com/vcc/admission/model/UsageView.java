package com.vcc.admission.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * An organization's usage of one resource in the current period, with the limit joined
 * from the plan table at read time.
 *
 * <p>The flags are derived together in {@link #of} so they never disagree:
 * exceeded implies percentage &ge; 100, warning implies 80 &le; percentage &lt; 100, and an
 * unlimited resource is never warning or exceeded.
 */
public record UsageView(
        String organizationId,
        ResourceType resourceType,
        PlanTier plan,
        long used,
        Long limit,
        boolean unlimited,
        Double percentage,
        boolean warning,
        boolean exceeded,
        Standing standing,
        LocalDate periodStart,
        int resetsInDays,
        Instant resetAt
) {

    public static final double WARNING_PERCENT = 80.0d;

    public static UsageView of(String organizationId,
                               ResourceType resourceType,
                               PlanTier plan,
                               long used,
                               QuotaLimit limit,
                               BillingPeriod period,
                               Instant now) {
        long safeUsed = Math.max(0, used);
        int resetsInDays = period.daysUntilReset(now);
        if (limit.unlimited()) {
            return new UsageView(organizationId, resourceType, plan, safeUsed, null, true, null,
                    false, false, Standing.UNDER_LIMIT, period.start(), resetsInDays, period.endsAt());
        }

        long max = limit.value();
        boolean exceeded = safeUsed >= max;
        double percentage;
        if (max == 0) {
            percentage = 100.0d;
        } else {
            percentage = BigDecimal.valueOf(safeUsed * 100.0d / max)
                    .setScale(1, RoundingMode.HALF_UP)
                    .doubleValue();
        }
        // Rounding can land 99.96% on 100.0 while still under the limit
        if (!exceeded && percentage >= 100.0d) {
            percentage = 99.9d;
        }
        boolean warning = !exceeded && percentage >= WARNING_PERCENT;
        Standing standing = exceeded ? Standing.BLOCKED
                : warning ? Standing.WARNING_ZONE
                : Standing.UNDER_LIMIT;

        return new UsageView(organizationId, resourceType, plan, safeUsed, max, false, percentage,
                warning, exceeded, standing, period.start(), resetsInDays, period.endsAt());
    }

    public long remaining() {
        if (unlimited) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, limit - used);
    }
}
