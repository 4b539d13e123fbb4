package com.numbertrack.backend.modules.employee.domain;

/**
 * Published synchronously inside the transaction that changes an employee's status or removes the employee.
 * A listener that throws aborts the change.
 */
public record EmployeeStatusChangedEvent(
        String employeeId,
        EmploymentStatus previousStatus,
        EmploymentStatus newStatus,
        boolean removed
) {

    public boolean isDeparture() {
        return removed || (newStatus == EmploymentStatus.DEPARTED && previousStatus != EmploymentStatus.DEPARTED);
    }
}
