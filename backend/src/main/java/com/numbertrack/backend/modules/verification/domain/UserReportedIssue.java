package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A dispute raised from a confirmation page. Exactly one of {@code mobileNumberId} and
 * {@code reportedPhoneNumber} is set. Rows are inserted through the upsert statements in
 * {@code UserReportedIssueRepository}; this mapping is used for reads and for admin review.
 */
@Entity
@Table(name = "user_reported_issue")
public class UserReportedIssue extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "verification_token_id", columnDefinition = "uuid")
    private UUID verificationTokenId;

    @Column(name = "reported_by_employee_id", nullable = false, updatable = false, length = 20)
    private String reportedByEmployeeId;

    @Column(name = "mobile_number_id", updatable = false, columnDefinition = "uuid")
    private UUID mobileNumberId;

    @Column(name = "reported_phone_number", updatable = false, length = 20)
    private String reportedPhoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "issue_type", nullable = false, updatable = false, length = 32)
    private ReportedIssueType issueType;

    @Column(name = "user_comment", length = 500)
    private String userComment;

    @Column(name = "purpose", length = 255)
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "admin_action_status", nullable = false, length = 32)
    private IssueReviewStatus adminActionStatus;

    @Column(name = "admin_remarks", length = 500)
    private String adminRemarks;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    protected UserReportedIssue() {
    }

    public void resolve(IssueReviewStatus outcome, String remarks, UUID adminUserId, OffsetDateTime now) {
        if (adminActionStatus != IssueReviewStatus.PENDING_REVIEW) {
            throw new IllegalStateException("issue " + id + " is already " + adminActionStatus.getValue());
        }
        if (outcome == null || !outcome.isClosing()) {
            throw new IllegalArgumentException("an issue can only be resolved or ignored");
        }
        this.adminActionStatus = outcome;
        this.adminRemarks = remarks;
        this.resolvedBy = adminUserId;
        this.resolvedAt = now;
    }

    public boolean isPending() {
        return adminActionStatus == IssueReviewStatus.PENDING_REVIEW;
    }

    public UUID getId() {
        return id;
    }

    public UUID getVerificationTokenId() {
        return verificationTokenId;
    }

    public String getReportedByEmployeeId() {
        return reportedByEmployeeId;
    }

    public UUID getMobileNumberId() {
        return mobileNumberId;
    }

    public String getReportedPhoneNumber() {
        return reportedPhoneNumber;
    }

    public ReportedIssueType getIssueType() {
        return issueType;
    }

    public String getUserComment() {
        return userComment;
    }

    public String getPurpose() {
        return purpose;
    }

    public IssueReviewStatus getAdminActionStatus() {
        return adminActionStatus;
    }

    public String getAdminRemarks() {
        return adminRemarks;
    }

    public UUID getResolvedBy() {
        return resolvedBy;
    }

    public OffsetDateTime getResolvedAt() {
        return resolvedAt;
    }
}
