package com.numbertrack.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonValue;

public record VerificationInfoResponse(
        String employeeId,
        String employeeName,
        String department,
        List<PhoneNumberEntry> phoneNumbers,
        List<UnlistedReport> previouslyReportedUnlisted,
        OffsetDateTime expiresAt
) {

    /**
     * What the employee has answered for a number under this link so far. A report outranks a confirmation.
     */
    public enum NumberState {
        PENDING("pending"),
        CONFIRMED("confirmed"),
        REPORTED("reported");

        private final String value;

        NumberState(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public record PhoneNumberEntry(
            UUID id,
            String phoneNumber,
            String department,
            String purpose,
            NumberState status,
            String userComment
    ) {
    }

    public record UnlistedReport(String phoneNumber, String userComment, String purpose, OffsetDateTime reportedAt) {
    }
}
