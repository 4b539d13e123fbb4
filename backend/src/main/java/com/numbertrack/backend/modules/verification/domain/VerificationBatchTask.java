package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.numbertrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One verification campaign run. Counters only move forward and the row is frozen once the status is terminal.
 */
@Entity
@Table(name = "verification_batch_task")
public class VerificationBatchTask extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private VerificationBatchStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, updatable = false, length = 32)
    private VerificationScopeType scopeType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scope_values", columnDefinition = "jsonb", updatable = false)
    private List<String> scopeValues = new ArrayList<>();

    @Column(name = "duration_days", nullable = false, updatable = false)
    private int durationDays;

    @Column(name = "total_employees", nullable = false)
    private int totalEmployees;

    @Column(name = "tokens_generated", nullable = false)
    private int tokensGenerated;

    @Column(name = "emails_attempted", nullable = false)
    private int emailsAttempted;

    @Column(name = "emails_succeeded", nullable = false)
    private int emailsSucceeded;

    @Column(name = "emails_failed", nullable = false)
    private int emailsFailed;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_summary", columnDefinition = "jsonb")
    private List<BatchFailure> errorSummary = new ArrayList<>();

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "initiated_by")
    private UUID initiatedBy;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    protected VerificationBatchTask() {
    }

    public static VerificationBatchTask create(
            VerificationScopeType scopeType,
            List<String> scopeValues,
            int durationDays,
            int totalEmployees,
            UUID initiatedBy
    ) {
        VerificationBatchTask task = new VerificationBatchTask();
        task.status = VerificationBatchStatus.PENDING;
        task.scopeType = scopeType;
        task.scopeValues = new ArrayList<>(scopeValues);
        task.durationDays = durationDays;
        task.totalEmployees = totalEmployees;
        task.initiatedBy = initiatedBy;
        return task;
    }

    public void start(OffsetDateTime now) {
        requireOpen();
        if (status == VerificationBatchStatus.PENDING) {
            status = VerificationBatchStatus.IN_PROGRESS;
            startedAt = now;
        }
    }

    public void recordTokenIssued() {
        requireOpen();
        tokensGenerated++;
    }

    public void recordEmailSucceeded() {
        requireOpen();
        emailsAttempted++;
        emailsSucceeded++;
    }

    public void recordEmailFailed(BatchFailure failure) {
        requireOpen();
        emailsAttempted++;
        emailsFailed++;
        errorSummary = appended(failure);
    }

    /**
     * Token could not be issued. No email is attempted, but the employee counts as a failed delivery.
     */
    public void recordTokenFailed(BatchFailure failure) {
        requireOpen();
        emailsFailed++;
        errorSummary = appended(failure);
    }

    public void complete(OffsetDateTime now) {
        requireOpen();
        status = emailsFailed == 0
                ? VerificationBatchStatus.COMPLETED
                : VerificationBatchStatus.COMPLETED_WITH_ERRORS;
        completedAt = now;
    }

    public void fail(String reason, OffsetDateTime now) {
        requireOpen();
        status = VerificationBatchStatus.FAILED;
        failureReason = reason;
        completedAt = now;
    }

    /**
     * Employees that already have a failure entry; a resumed run must not count them twice.
     */
    public Set<String> failedEmployeeIds() {
        return getErrorSummary().stream()
                .map(BatchFailure::employeeId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private List<BatchFailure> appended(BatchFailure failure) {
        // new list instance so the JSON column is seen as dirty
        List<BatchFailure> updated = new ArrayList<>(errorSummary == null ? List.of() : errorSummary);
        updated.add(failure);
        return updated;
    }

    private void requireOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("batch task " + id + " is already " + status.getValue());
        }
    }

    public UUID getId() {
        return id;
    }

    public VerificationBatchStatus getStatus() {
        return status;
    }

    public VerificationScopeType getScopeType() {
        return scopeType;
    }

    public List<String> getScopeValues() {
        return scopeValues == null ? List.of() : List.copyOf(scopeValues);
    }

    public int getDurationDays() {
        return durationDays;
    }

    public int getTotalEmployees() {
        return totalEmployees;
    }

    public int getTokensGenerated() {
        return tokensGenerated;
    }

    public int getEmailsAttempted() {
        return emailsAttempted;
    }

    public int getEmailsSucceeded() {
        return emailsSucceeded;
    }

    public int getEmailsFailed() {
        return emailsFailed;
    }

    public List<BatchFailure> getErrorSummary() {
        return errorSummary == null ? List.of() : List.copyOf(errorSummary);
    }

    public String getFailureReason() {
        return failureReason;
    }

    public UUID getInitiatedBy() {
        return initiatedBy;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }
}
