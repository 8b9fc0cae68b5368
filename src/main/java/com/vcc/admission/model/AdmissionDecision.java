package com.vcc.admission.model;

import java.util.List;

/**
 * Outcome of the layered admission check. On rejection the fields describe the
 * rejecting layer; {@code layers} lists every layer that was evaluated.
 * {@code reservation} is set on admitted quota-relevant requests and must be settled
 * after the response.
 */
public record AdmissionDecision(
        boolean allowed,
        LayerScope rejectingLayer,
        Long limit,
        long used,
        Long retryAfterSeconds,
        Integer resetsInDays,
        String upgradeUrl,
        String error,
        String message,
        List<LayerOutcome> layers,
        QuotaReservation reservation
) {

    public static final String ERROR_RATE_LIMITED = "rate_limit_exceeded";
    public static final String ERROR_QUOTA_EXCEEDED = "quota_exceeded";
    public static final String ERROR_UNAVAILABLE = "admission_unavailable";

    public static AdmissionDecision allow(List<LayerOutcome> layers) {
        return allow(layers, null);
    }

    public static AdmissionDecision allow(List<LayerOutcome> layers, QuotaReservation reservation) {
        return new AdmissionDecision(true, null, null, 0, null, null, null, null, null, List.copyOf(layers),
                reservation);
    }

    public static AdmissionDecision rateLimited(LayerScope layer,
                                                long limit,
                                                long used,
                                                long retryAfterSeconds,
                                                String error,
                                                String message,
                                                List<LayerOutcome> layers) {
        return new AdmissionDecision(false, layer, limit, used, retryAfterSeconds, null, null,
                error, message, List.copyOf(layers), null);
    }

    public static AdmissionDecision quotaExceeded(Long limit,
                                                  long used,
                                                  int resetsInDays,
                                                  String upgradeUrl,
                                                  String error,
                                                  String message,
                                                  List<LayerOutcome> layers) {
        return new AdmissionDecision(false, LayerScope.ORGANIZATION, limit, used, null, resetsInDays,
                upgradeUrl, error, message, List.copyOf(layers), null);
    }

    /**
     * Rejection decided by the failure policy because a layer's backing store did not answer.
     */
    public static AdmissionDecision unavailable(LayerScope layer,
                                                Long limit,
                                                long retryAfterSeconds,
                                                String message,
                                                List<LayerOutcome> layers) {
        return new AdmissionDecision(false, layer, limit, 0, retryAfterSeconds, null, null,
                ERROR_UNAVAILABLE, message, List.copyOf(layers), null);
    }

    /**
     * The outcome of a given layer, or null when that layer was not evaluated.
     */
    public LayerOutcome layer(LayerScope scope) {
        for (LayerOutcome outcome : layers) {
            if (outcome.scope() == scope) {
                return outcome;
            }
        }
        return null;
    }
}
