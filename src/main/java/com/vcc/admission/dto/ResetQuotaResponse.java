package com.vcc.admission.dto;

import com.vcc.admission.model.QuotaReset;
import com.vcc.admission.model.UsageView;

import java.time.LocalDate;

/**
 * Response DTO for an administrative quota reset.
 */
public record ResetQuotaResponse(
        String organizationId,
        String resourceType,
        LocalDate periodStart,
        long previousUsed,
        UsageView usage,
        String resetBy
) {

    public static ResetQuotaResponse from(QuotaReset reset, String actor) {
        return new ResetQuotaResponse(
                reset.organizationId(),
                reset.resourceType().code(),
                reset.periodStart(),
                reset.previousUsed(),
                reset.usage(),
                actor
        );
    }
}
