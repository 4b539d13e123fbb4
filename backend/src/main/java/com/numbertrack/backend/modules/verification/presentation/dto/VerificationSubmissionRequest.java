package com.numbertrack.backend.modules.verification.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.VerificationActionType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record VerificationSubmissionRequest(
        List<@Valid @NotNull VerifiedNumber> verifiedNumbers,
        List<@Valid @NotNull UnlistedNumber> unlistedNumbersReported
) {

    public List<VerifiedNumber> verifiedNumbersOrEmpty() {
        return verifiedNumbers == null ? List.of() : verifiedNumbers;
    }

    public List<UnlistedNumber> unlistedNumbersOrEmpty() {
        return unlistedNumbersReported == null ? List.of() : unlistedNumbersReported;
    }

    /**
     * {@code action} is {@code confirm_usage} or {@code report_issue}.
     */
    public record VerifiedNumber(
            @NotNull(message = "mobileNumberId is required") UUID mobileNumberId,
            @NotNull(message = "action is required") VerificationActionType action,
            @Size(max = 255) String purpose,
            @Size(max = 500) String userComment
    ) {
    }

    public record UnlistedNumber(
            @NotBlank(message = "phoneNumber is required")
            @Pattern(regexp = "^\\d{11}$", message = "phoneNumber must be 11 digits")
            String phoneNumber,
            @NotBlank(message = "purpose is required") @Size(max = 255) String purpose,
            @Size(max = 500) String userComment
    ) {
    }
}
