package com.numbertrack.backend.modules.employee.presentation.dto;

import java.util.List;

public record EmployeePageResponse(List<EmployeeResponse> items, int page, int size, long totalCount) {
}
