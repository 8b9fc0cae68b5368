package com.vcc.admission.dto;

/**
 * Error body returned by the admin API.
 */
public record ErrorResponse(String error, String message) {
}
