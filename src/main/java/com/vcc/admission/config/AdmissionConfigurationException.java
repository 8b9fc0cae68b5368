package com.vcc.admission.config;

/**
 * Invalid admission configuration: an unknown plan tier, resource type or role, or a
 * malformed limit. Raised while the application context starts, never per request.
 */
public class AdmissionConfigurationException extends RuntimeException {

    public AdmissionConfigurationException(String message) {
        super(message);
    }

    public AdmissionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
