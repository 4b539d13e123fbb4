package com.numbertrack.backend.modules.verification.presentation.dto;

import com.numbertrack.backend.modules.verification.domain.IssueReviewStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * {@code status} is {@code resolved} or {@code ignored}.
 */
public record ResolveIssueRequest(
        @NotNull(message = "status is required") IssueReviewStatus status,
        @Size(max = 500) String adminRemarks
) {
}
