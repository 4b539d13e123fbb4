package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.time.LocalDate;
import java.util.List;

public record MobileNumberDetailResponse(
        MobileNumberResponse number,
        List<UsageInterval> usageHistory,
        List<ApplicantChange> applicantHistory
) {

    public record UsageInterval(String employeeId, LocalDate startDate, LocalDate endDate) {
    }

    public record ApplicantChange(
            String previousApplicantEmployeeId,
            String newApplicantEmployeeId,
            LocalDate changeDate,
            String operatorEmployeeId,
            String remarks
    ) {
    }
}
