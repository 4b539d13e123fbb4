package com.numbertrack.backend.modules.verification.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

class VerificationBatchTaskTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-02-01T10:00:00Z");

    @Test
    void runWithoutFailuresCompletesCleanly() {
        VerificationBatchTask task = newTask();
        task.start(NOW);
        task.recordTokenIssued();
        task.recordEmailSucceeded();
        task.complete(NOW.plusMinutes(1));

        assertThat(task.getStatus()).isEqualTo(VerificationBatchStatus.COMPLETED);
        assertThat(task.getStartedAt()).isEqualTo(NOW);
        assertThat(task.getEmailsAttempted()).isEqualTo(1);
        assertThat(task.getErrorSummary()).isNullOrEmpty();
    }

    @Test
    void tokenFailureCountsAsFailedDeliveryWithoutAnAttempt() {
        VerificationBatchTask task = newTask();
        task.start(NOW);
        task.recordTokenFailed(new BatchFailure("EMP0000001", "Alice", "N/A", "Token creation failed: boom"));
        task.complete(NOW);

        assertThat(task.getStatus()).isEqualTo(VerificationBatchStatus.COMPLETED_WITH_ERRORS);
        assertThat(task.getEmailsAttempted()).isZero();
        assertThat(task.getEmailsFailed()).isEqualTo(1);
        assertThat(task.getErrorSummary()).hasSize(1);
    }

    @Test
    void emptyResolvedScopeStillCompletes() {
        VerificationBatchTask task = VerificationBatchTask.create(VerificationScopeType.DEPARTMENT, List.of("Sales"), 7, 0, null);
        task.start(NOW);
        task.complete(NOW);

        assertThat(task.getStatus()).isEqualTo(VerificationBatchStatus.COMPLETED);
        assertThat(task.getTotalEmployees()).isZero();
    }

    @Test
    void failedEmployeeIdsCoverEveryRecordedFailure() {
        VerificationBatchTask task = newTask();
        task.start(NOW);
        task.recordTokenFailed(new BatchFailure("EMP0000001", "Alice", "N/A", "Token creation failed: boom"));
        task.recordTokenIssued();
        task.recordEmailFailed(new BatchFailure("EMP0000002", "Bob", "N/A", "Missing email address"));

        assertThat(task.failedEmployeeIds()).containsExactlyInAnyOrder("EMP0000001", "EMP0000002");
        assertThat(task.getTotalEmployees()).isEqualTo(2);
    }

    @Test
    void terminalTaskRejectsFurtherProgress() {
        VerificationBatchTask task = newTask();
        task.fail("Worker queue full", NOW);

        assertThat(task.isTerminal()).isTrue();
        assertThat(task.getFailureReason()).isEqualTo("Worker queue full");
        assertThatThrownBy(task::recordTokenIssued).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> task.complete(NOW)).isInstanceOf(IllegalStateException.class);
    }

    private static VerificationBatchTask newTask() {
        return VerificationBatchTask.create(VerificationScopeType.DEPARTMENT, List.of("Sales"), 7, 2, null);
    }
}
