package com.tradinggrok.validation;

import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/emergency-stop}. The reason is optional.
 */
public record EmergencyStopRequest(
    @Size(max = 200, message = "Reason cannot exceed 200 characters")
    String reason
) {
    public static final String DEFAULT_REASON = "Operator emergency stop";

    public String reasonOrDefault() {
        return reason == null || reason.isBlank() ? DEFAULT_REASON : reason.trim();
    }
}
