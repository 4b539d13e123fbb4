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

import org.hibernate.annotations.UuidGenerator;

/**
 * One possession interval. Rows are only ever inserted, and {@link #close} is the single permitted update.
 */
@Entity
@Table(name = "number_usage_history")
public class NumberUsageHistory {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "mobile_number_id", nullable = false, updatable = false)
    private MobileNumber mobileNumber;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 20)
    private String employeeId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected NumberUsageHistory() {
    }

    public static NumberUsageHistory open(MobileNumber mobileNumber, String employeeId, LocalDate startDate) {
        NumberUsageHistory history = new NumberUsageHistory();
        history.mobileNumber = mobileNumber;
        history.employeeId = employeeId;
        history.startDate = startDate;
        return history;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public void close(LocalDate endDate) {
        if (this.endDate != null) {
            throw new IllegalStateException("usage interval already closed");
        }
        this.endDate = endDate;
    }

    public UUID getId() {
        return id;
    }

    public MobileNumber getMobileNumber() {
        return mobileNumber;
    }

    public String getEmployeeId() {
        return employeeId;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
