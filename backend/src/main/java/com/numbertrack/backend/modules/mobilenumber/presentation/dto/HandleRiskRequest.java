package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import com.numbertrack.backend.modules.mobilenumber.domain.RiskAction;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record HandleRiskRequest(
        @NotNull(message = "action is required") RiskAction action,
        String newApplicantEmployeeId,
        @Size(max = 500) String remarks
) {
}
