package com.numbertrack.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;

public record VerificationSubmissionResponse(
        int confirmedCount,
        int reportedCount,
        int unlistedReportedCount,
        OffsetDateTime submittedAt,
        OffsetDateTime tokenExpiresAt
) {
}
