package com.vcc.admission.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Plan change notification from billing.
 */
public record PlanChangedRequest(
        @NotBlank(message = "Organization ID is required")
        @Size(max = 64, message = "Organization ID must be at most 64 characters")
        String organizationId,

        @NotBlank(message = "Plan is required")
        @Pattern(regexp = "^(free|pro|enterprise)$", message = "Plan must be one of: free, pro, enterprise")
        String plan
) {
}
