package com.numbertrack.backend.modules.employee.application;

import java.util.List;
import java.util.Optional;

import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmployeeScope;

/**
 * Read access to employees for the number lifecycle and verification modules.
 * Soft-deleted employees are never returned.
 */
public interface EmployeeDirectory {

    Optional<Employee> findByEmployeeId(String employeeId);

    /**
     * @throws com.numbertrack.backend.global.error.ProblemException 404 {@code EMPLOYEE_NOT_FOUND}
     */
    Employee getByEmployeeId(String employeeId);

    /**
     * Active employees selected by {@code scope}, ordered by business id.
     */
    List<Employee> findActiveByScope(EmployeeScope scope);
}
