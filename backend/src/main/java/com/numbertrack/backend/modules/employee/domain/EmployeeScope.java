package com.numbertrack.backend.modules.employee.domain;

import java.util.List;
import java.util.Objects;

/**
 * Selection rule for active employees: everyone, a set of departments, or an explicit id list.
 */
public record EmployeeScope(Type type, List<String> values) {

    public enum Type {
        ALL,
        DEPARTMENTS,
        EMPLOYEE_IDS
    }

    public EmployeeScope {
        Objects.requireNonNull(type, "type");
        values = values == null ? List.of() : values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }

    public static EmployeeScope all() {
        return new EmployeeScope(Type.ALL, List.of());
    }

    public static EmployeeScope departments(List<String> departments) {
        return new EmployeeScope(Type.DEPARTMENTS, departments);
    }

    public static EmployeeScope employeeIds(List<String> employeeIds) {
        return new EmployeeScope(Type.EMPLOYEE_IDS, employeeIds);
    }
}
