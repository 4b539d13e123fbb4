package com.numbertrack.backend.modules.mobilenumber.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Convert;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A company-issued phone number.
 * <p>
 * {@code applicantEmployeeId} is who procured the line; {@code currentEmployeeId} is who holds it now.
 * An {@code in_use} number always has a holder with exactly one open {@link NumberUsageHistory} row.
 * Flagged numbers ({@code risk_pending}, {@code user_reported}) keep their holder and open row until an
 * admin reclaims or resolves them; every other status has no holder.
 */
@Entity
@Table(name = "mobile_number")
public class MobileNumber extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 20, unique = true)
    private String phoneNumber;

    @Column(name = "applicant_employee_id", nullable = false, length = 20)
    private String applicantEmployeeId;

    @Column(name = "application_date", nullable = false)
    private LocalDate applicationDate;

    @Column(name = "current_employee_id", length = 20)
    private String currentEmployeeId;

    @Convert(converter = MobileNumberStatusConverter.class)
    @Column(name = "status", nullable = false, length = 30)
    private MobileNumberStatus status = MobileNumberStatus.IDLE;

    @Column(name = "purpose", length = 255)
    private String purpose;

    @Column(name = "vendor", length = 100)
    private String vendor;

    @Column(name = "remarks", length = 500)
    private String remarks;

    @Column(name = "cancellation_date")
    private LocalDate cancellationDate;

    @Column(name = "last_confirmation_date")
    private OffsetDateTime lastConfirmationDate;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public void assignTo(String employeeId) {
        this.currentEmployeeId = employeeId;
        this.status = MobileNumberStatus.IN_USE;
    }

    public void release() {
        this.currentEmployeeId = null;
        this.status = MobileNumberStatus.IDLE;
    }

    public void deactivate(LocalDate cancellationDate) {
        this.currentEmployeeId = null;
        this.status = MobileNumberStatus.DEACTIVATED;
        this.cancellationDate = cancellationDate;
    }

    /**
     * Leaves a flagged state: back to {@code in_use} when someone still holds the line, otherwise {@code idle}.
     */
    public void settle() {
        this.status = currentEmployeeId != null ? MobileNumberStatus.IN_USE : MobileNumberStatus.IDLE;
    }

    public void confirmUsage(OffsetDateTime confirmedAt) {
        this.lastConfirmationDate = confirmedAt;
    }

    public boolean hasHolder() {
        return currentEmployeeId != null;
    }

    public UUID getId() {
        return id;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public String getApplicantEmployeeId() {
        return applicantEmployeeId;
    }

    public void setApplicantEmployeeId(String applicantEmployeeId) {
        this.applicantEmployeeId = applicantEmployeeId;
    }

    public LocalDate getApplicationDate() {
        return applicationDate;
    }

    public void setApplicationDate(LocalDate applicationDate) {
        this.applicationDate = applicationDate;
    }

    public String getCurrentEmployeeId() {
        return currentEmployeeId;
    }

    public MobileNumberStatus getStatus() {
        return status;
    }

    public void setStatus(MobileNumberStatus status) {
        this.status = status;
    }

    public String getPurpose() {
        return purpose;
    }

    public void setPurpose(String purpose) {
        this.purpose = purpose;
    }

    public String getVendor() {
        return vendor;
    }

    public void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public String getRemarks() {
        return remarks;
    }

    public void setRemarks(String remarks) {
        this.remarks = remarks;
    }

    public LocalDate getCancellationDate() {
        return cancellationDate;
    }

    public void setCancellationDate(LocalDate cancellationDate) {
        this.cancellationDate = cancellationDate;
    }

    public OffsetDateTime getLastConfirmationDate() {
        return lastConfirmationDate;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }
}
