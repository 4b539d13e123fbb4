package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;

/**
 * Issue joined with its reporter and, for number issues, the number's live status.
 */
public record ReportedIssueRow(
        UUID issueId,
        ReportedIssueType issueType,
        String phoneNumber,
        MobileNumberStatus numberStatus,
        String reportedByEmployeeId,
        String reportedByName,
        String department,
        String userComment,
        String purpose,
        IssueReviewStatus adminActionStatus,
        String adminRemarks,
        OffsetDateTime reportedAt,
        OffsetDateTime updatedAt
) {
}
