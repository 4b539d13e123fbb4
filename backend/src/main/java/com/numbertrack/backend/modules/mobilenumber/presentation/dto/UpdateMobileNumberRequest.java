package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;

import jakarta.validation.constraints.Size;

public record UpdateMobileNumberRequest(
        MobileNumberStatus status,
        @Size(max = 255) String purpose,
        @Size(max = 100) String vendor,
        @Size(max = 500) String remarks
) {
}
