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
 * Credential for one employee's confirmation page. Submitting does not consume it; it stays usable until expiry.
 */
@Entity
@Table(name = "verification_token")
public class VerificationToken extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "token", nullable = false, updatable = false, unique = true, length = 64)
    private String token;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 20)
    private String employeeId;

    @Column(name = "batch_task_id", updatable = false, columnDefinition = "uuid")
    private UUID batchTaskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private VerificationTokenStatus status;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", length = 16)
    private TokenDeliveryStatus deliveryStatus;

    protected VerificationToken() {
    }

    public static VerificationToken issue(String token, String employeeId, UUID batchTaskId, OffsetDateTime expiresAt) {
        VerificationToken issued = new VerificationToken();
        issued.token = token;
        issued.employeeId = employeeId;
        issued.batchTaskId = batchTaskId;
        issued.expiresAt = expiresAt;
        issued.status = VerificationTokenStatus.PENDING;
        return issued;
    }

    public boolean isUsableAt(OffsetDateTime now) {
        return status == VerificationTokenStatus.PENDING && !now.isAfter(expiresAt);
    }

    public void markDelivered() {
        deliveryStatus = TokenDeliveryStatus.SENT;
    }

    public void markDeliveryFailed() {
        deliveryStatus = TokenDeliveryStatus.FAILED;
    }

    /**
     * False when the run stopped between storing the token and mailing it.
     */
    public boolean hasDeliveryOutcome() {
        return deliveryStatus != null;
    }

    public UUID getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public String getEmployeeId() {
        return employeeId;
    }

    public UUID getBatchTaskId() {
        return batchTaskId;
    }

    public VerificationTokenStatus getStatus() {
        return status;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public TokenDeliveryStatus getDeliveryStatus() {
        return deliveryStatus;
    }
}
