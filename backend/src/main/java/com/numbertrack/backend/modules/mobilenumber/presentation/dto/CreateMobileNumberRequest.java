package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateMobileNumberRequest(
        @NotBlank(message = "phoneNumber is required") String phoneNumber,
        @NotBlank(message = "applicantEmployeeId is required") String applicantEmployeeId,
        @NotNull(message = "applicationDate is required") LocalDate applicationDate,
        @Size(max = 255) String purpose,
        @Size(max = 100) String vendor,
        @Size(max = 500) String remarks
) {
}
