package com.numbertrack.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Append-only record of a single submitted action. The identity id orders rows written in the same instant.
 */
@Entity
@Immutable
@Table(name = "verification_submission_log")
public class VerificationSubmissionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "employee_id", nullable = false, length = 20)
    private String employeeId;

    @Column(name = "verification_token_id", columnDefinition = "uuid")
    private UUID verificationTokenId;

    @Column(name = "mobile_number_id", columnDefinition = "uuid")
    private UUID mobileNumberId;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32)
    private VerificationActionType actionType;

    @Column(name = "purpose", length = 255)
    private String purpose;

    @Column(name = "user_comment", length = 500)
    private String userComment;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected VerificationSubmissionLog() {
    }

    public static VerificationSubmissionLog append(
            String employeeId,
            UUID verificationTokenId,
            UUID mobileNumberId,
            String phoneNumber,
            VerificationActionType actionType,
            String purpose,
            String userComment,
            OffsetDateTime createdAt
    ) {
        VerificationSubmissionLog entry = new VerificationSubmissionLog();
        entry.employeeId = employeeId;
        entry.verificationTokenId = verificationTokenId;
        entry.mobileNumberId = mobileNumberId;
        entry.phoneNumber = phoneNumber;
        entry.actionType = actionType;
        entry.purpose = purpose;
        entry.userComment = userComment;
        entry.createdAt = createdAt;
        return entry;
    }

    public Long getId() {
        return id;
    }

    public String getEmployeeId() {
        return employeeId;
    }

    public UUID getVerificationTokenId() {
        return verificationTokenId;
    }

    public UUID getMobileNumberId() {
        return mobileNumberId;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public VerificationActionType getActionType() {
        return actionType;
    }

    public String getPurpose() {
        return purpose;
    }

    public String getUserComment() {
        return userComment;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
