package com.numbertrack.backend.modules.mobilenumber.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(name = "number_applicant_history")
public class NumberApplicantHistory {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "mobile_number_id", nullable = false, updatable = false)
    private MobileNumber mobileNumber;

    @Column(name = "previous_applicant_employee_id", nullable = false, updatable = false, length = 20)
    private String previousApplicantEmployeeId;

    @Column(name = "new_applicant_employee_id", nullable = false, updatable = false, length = 20)
    private String newApplicantEmployeeId;

    @Column(name = "change_date", nullable = false, updatable = false)
    private LocalDate changeDate;

    @Column(name = "operator_employee_id", nullable = false, updatable = false, length = 20)
    private String operatorEmployeeId;

    @Column(name = "remarks", updatable = false, length = 500)
    private String remarks;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected NumberApplicantHistory() {
    }

    public static NumberApplicantHistory record(
            MobileNumber mobileNumber,
            String previousApplicantEmployeeId,
            String newApplicantEmployeeId,
            LocalDate changeDate,
            String operatorEmployeeId,
            String remarks
    ) {
        NumberApplicantHistory history = new NumberApplicantHistory();
        history.mobileNumber = mobileNumber;
        history.previousApplicantEmployeeId = previousApplicantEmployeeId;
        history.newApplicantEmployeeId = newApplicantEmployeeId;
        history.changeDate = changeDate;
        history.operatorEmployeeId = operatorEmployeeId;
        history.remarks = remarks;
        return history;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public MobileNumber getMobileNumber() {
        return mobileNumber;
    }

    public String getPreviousApplicantEmployeeId() {
        return previousApplicantEmployeeId;
    }

    public String getNewApplicantEmployeeId() {
        return newApplicantEmployeeId;
    }

    public LocalDate getChangeDate() {
        return changeDate;
    }

    public String getOperatorEmployeeId() {
        return operatorEmployeeId;
    }

    public String getRemarks() {
        return remarks;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
