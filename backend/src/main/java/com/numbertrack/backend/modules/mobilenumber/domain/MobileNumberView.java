package com.numbertrack.backend.modules.mobilenumber.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;

/**
 * Number row joined with applicant and holder names, as shown in admin listings.
 */
public record MobileNumberView(
        UUID id,
        String phoneNumber,
        String applicantEmployeeId,
        String applicantName,
        EmploymentStatus applicantStatus,
        LocalDate applicationDate,
        String currentEmployeeId,
        String currentUserName,
        MobileNumberStatus status,
        String purpose,
        String vendor,
        String remarks,
        LocalDate cancellationDate,
        OffsetDateTime lastConfirmationDate,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
