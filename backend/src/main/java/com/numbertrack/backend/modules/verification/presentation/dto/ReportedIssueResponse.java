package com.numbertrack.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.verification.domain.IssueReviewStatus;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueRow;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;

public record ReportedIssueResponse(
        UUID issueId,
        ReportedIssueType issueType,
        String phoneNumber,
        MobileNumberStatus numberStatus,
        String reportedByEmployeeId,
        String reportedBy,
        String department,
        String comment,
        String purpose,
        IssueReviewStatus adminActionStatus,
        String adminRemarks,
        OffsetDateTime reportedAt,
        OffsetDateTime updatedAt
) {

    public static ReportedIssueResponse from(ReportedIssueRow row) {
        return new ReportedIssueResponse(
                row.issueId(),
                row.issueType(),
                row.phoneNumber(),
                row.numberStatus(),
                row.reportedByEmployeeId(),
                row.reportedByName(),
                row.department(),
                row.userComment(),
                row.purpose(),
                row.adminActionStatus(),
                row.adminRemarks(),
                row.reportedAt(),
                row.updatedAt()
        );
    }
}
