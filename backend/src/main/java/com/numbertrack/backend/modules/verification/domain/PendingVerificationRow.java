package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PendingVerificationRow(
        String employeeId,
        String fullName,
        String email,
        String department,
        UUID tokenId,
        OffsetDateTime expiresAt
) {
}
