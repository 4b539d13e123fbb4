package com.numbertrack.backend.modules.verification.presentation.dto;

import java.util.List;

import com.numbertrack.backend.modules.verification.domain.VerificationScopeType;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * {@code durationDays} falls back to {@code app.verification.default-duration-days} when omitted.
 */
public record InitiateVerificationRequest(
        @NotNull(message = "scope is required") VerificationScopeType scope,
        List<String> scopeValues,
        @Min(value = 1, message = "durationDays must be between 1 and 30")
        @Max(value = 30, message = "durationDays must be between 1 and 30")
        Integer durationDays
) {
}
