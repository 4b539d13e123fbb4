package com.numbertrack.backend.modules.verification.domain;

/**
 * One entry of a batch task's error summary.
 */
public record BatchFailure(String employeeId, String employeeName, String emailAddress, String reason) {
}
