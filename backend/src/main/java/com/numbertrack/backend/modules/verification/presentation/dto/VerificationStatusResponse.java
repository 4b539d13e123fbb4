package com.numbertrack.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record VerificationStatusResponse(
        Summary summary,
        List<ConfirmedPhone> confirmedPhones,
        List<PendingUser> pendingUsers,
        List<ReportedIssueResponse> reportedIssues,
        List<ReportedIssueResponse> unlistedNumbers
) {

    public record Summary(
            long totalPhonesCount,
            long confirmedPhonesCount,
            long reportedIssuesCount,
            long pendingPhonesCount,
            long newlyReportedPhonesCount
    ) {
    }

    public record ConfirmedPhone(
            UUID id,
            String phoneNumber,
            String department,
            String currentUser,
            String purpose,
            String confirmedBy,
            OffsetDateTime confirmedAt
    ) {
    }

    public record PendingUser(
            String employeeId,
            String fullName,
            String email,
            String department,
            UUID tokenId,
            OffsetDateTime expiresAt
    ) {
    }
}
