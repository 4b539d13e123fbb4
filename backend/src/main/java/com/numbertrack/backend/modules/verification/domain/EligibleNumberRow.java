package com.numbertrack.backend.modules.verification.domain;

import java.util.UUID;

/**
 * A number counted by the verification status view, with its current holder if any.
 */
public record EligibleNumberRow(
        UUID mobileNumberId,
        String phoneNumber,
        String purpose,
        String holderEmployeeId,
        String holderName,
        String holderDepartment
) {
}
