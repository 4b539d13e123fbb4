package com.numbertrack.backend.modules.verification.presentation.dto;

import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.VerificationBatchStatus;

public record InitiateVerificationResponse(UUID batchId, VerificationBatchStatus status, int totalEmployees) {
}
