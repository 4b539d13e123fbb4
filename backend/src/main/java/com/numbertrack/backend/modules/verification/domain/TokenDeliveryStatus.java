package com.numbertrack.backend.modules.verification.domain;

/**
 * Outcome of mailing a token. Absent until the batch run records one.
 */
public enum TokenDeliveryStatus {
    SENT,
    FAILED
}
