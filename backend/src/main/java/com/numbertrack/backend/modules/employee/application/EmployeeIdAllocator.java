package com.numbertrack.backend.modules.employee.application;

import com.numbertrack.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.springframework.stereotype.Component;

/**
 * Reserves the next business id from {@code employee_business_id_seq} before the row is inserted.
 * Gaps left by rolled-back inserts are acceptable.
 */
@Component
public class EmployeeIdAllocator {

    static final String PREFIX = "EMP";

    private final EmployeeRepository employeeRepository;

    public EmployeeIdAllocator(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    public String allocate() {
        return format(employeeRepository.nextBusinessIdSequence());
    }

    static String format(long sequence) {
        return PREFIX + "%07d".formatted(sequence);
    }
}
