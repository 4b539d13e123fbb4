package com.numbertrack.backend.modules.employee.presentation.dto;

import java.time.LocalDate;

import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left untouched.
 */
public record UpdateEmployeeRequest(
        @Size(max = 100) String department,
        @Email(message = "email must be a valid address") @Size(max = 255) String email,
        EmploymentStatus employmentStatus,
        LocalDate hireDate,
        LocalDate terminationDate
) {
}
