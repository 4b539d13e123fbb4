package com.numbertrack.backend.modules.employee.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;

public record EmployeeResponse(
        String employeeId,
        String fullName,
        String phoneNumber,
        String email,
        String department,
        EmploymentStatus employmentStatus,
        LocalDate hireDate,
        LocalDate terminationDate,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(
                employee.getEmployeeId(),
                employee.getFullName(),
                employee.getPhoneNumber(),
                employee.getEmail(),
                employee.getDepartment(),
                employee.getEmploymentStatus(),
                employee.getHireDate(),
                employee.getTerminationDate(),
                employee.getCreatedAt(),
                employee.getUpdatedAt()
        );
    }
}
