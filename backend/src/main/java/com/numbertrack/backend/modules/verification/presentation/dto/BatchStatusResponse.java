package com.numbertrack.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.BatchFailure;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchStatus;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchTask;
import com.numbertrack.backend.modules.verification.domain.VerificationScopeType;

public record BatchStatusResponse(
        UUID batchId,
        VerificationBatchStatus status,
        VerificationScopeType scope,
        List<String> scopeValues,
        int durationDays,
        int totalEmployeesToProcess,
        int tokensGeneratedCount,
        int emailsAttemptedCount,
        int emailsSucceededCount,
        int emailsFailedCount,
        List<BatchFailure> errorSummary,
        String failureReason,
        OffsetDateTime createdAt,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt
) {

    public static BatchStatusResponse from(VerificationBatchTask task) {
        return new BatchStatusResponse(
                task.getId(),
                task.getStatus(),
                task.getScopeType(),
                task.getScopeValues(),
                task.getDurationDays(),
                task.getTotalEmployees(),
                task.getTokensGenerated(),
                task.getEmailsAttempted(),
                task.getEmailsSucceeded(),
                task.getEmailsFailed(),
                task.getErrorSummary(),
                task.getFailureReason(),
                task.getCreatedAt(),
                task.getStartedAt(),
                task.getCompletedAt()
        );
    }
}
