package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssignMobileNumberRequest(
        @NotBlank(message = "employeeId is required") String employeeId,
        @NotNull(message = "assignmentDate is required") LocalDate assignmentDate,
        @Size(max = 255) String purpose
) {
}
