package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LatestNumberAction(
        UUID mobileNumberId,
        VerificationActionType actionType,
        String employeeId,
        String employeeName,
        OffsetDateTime submittedAt
) {
}
