package com.numbertrack.backend.modules.employee.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateEmployeeRequest(
        @NotBlank(message = "fullName is required") @Size(max = 100) String fullName,
        String phoneNumber,
        @Email(message = "email must be a valid address") @Size(max = 255) String email,
        @Size(max = 100) String department,
        LocalDate hireDate
) {
}
