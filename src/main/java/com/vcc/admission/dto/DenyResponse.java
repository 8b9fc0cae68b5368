package com.vcc.admission.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vcc.admission.model.AdmissionDecision;

/**
 * Body of a 429 admission denial. Rate-limit denials carry {@code retry_after_seconds},
 * quota denials carry {@code resets_in_days} and {@code upgrade_url}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DenyResponse(
        String error,
        String message,
        String layer,
        Long limit,
        long used,
        @JsonProperty("retry_after_seconds") Long retryAfterSeconds,
        @JsonProperty("resets_in_days") Integer resetsInDays,
        @JsonProperty("upgrade_url") String upgradeUrl
) {

    public static DenyResponse from(AdmissionDecision decision) {
        return new DenyResponse(
                decision.error(),
                decision.message(),
                decision.rejectingLayer() != null ? decision.rejectingLayer().code() : null,
                decision.limit(),
                decision.used(),
                decision.retryAfterSeconds(),
                decision.resetsInDays(),
                decision.upgradeUrl()
        );
    }
}
