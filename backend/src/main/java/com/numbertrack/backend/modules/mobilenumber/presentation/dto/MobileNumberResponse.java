package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberView;

public record MobileNumberResponse(
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

    public static MobileNumberResponse from(MobileNumberView view) {
        return new MobileNumberResponse(
                view.id(),
                view.phoneNumber(),
                view.applicantEmployeeId(),
                view.applicantName(),
                view.applicantStatus(),
                view.applicationDate(),
                view.currentEmployeeId(),
                view.currentUserName(),
                view.status(),
                view.purpose(),
                view.vendor(),
                view.remarks(),
                view.cancellationDate(),
                view.lastConfirmationDate(),
                view.createdAt(),
                view.updatedAt()
        );
    }
}
