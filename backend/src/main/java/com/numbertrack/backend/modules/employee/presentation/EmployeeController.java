package com.numbertrack.backend.modules.employee.presentation;

import com.numbertrack.backend.modules.employee.application.EmployeeService;
import com.numbertrack.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.numbertrack.backend.modules.employee.presentation.dto.EmployeePageResponse;
import com.numbertrack.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.numbertrack.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/employees")
@Tag(name = "Employees", description = "Employee directory")
public class EmployeeController {

    private final EmployeeService employeeService;

    public EmployeeController(EmployeeService employeeService) {
        this.employeeService = employeeService;
    }

    @PostMapping
    @Operation(summary = "Create an employee; the business id is allocated by the server")
    public ResponseEntity<EmployeeResponse> create(@Valid @RequestBody CreateEmployeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(employeeService.createEmployee(request));
    }

    @GetMapping
    public ResponseEntity<EmployeePageResponse> list(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "employmentStatus", required = false) String employmentStatus
    ) {
        return ResponseEntity.ok(employeeService.listEmployees(page, limit, search, employmentStatus));
    }

    @GetMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> get(@PathVariable String employeeId) {
        return ResponseEntity.ok(employeeService.getEmployee(employeeId));
    }

    @PatchMapping("/{employeeId}")
    @Operation(summary = "Patch an employee; moving to Departed flags the numbers they applied for")
    public ResponseEntity<EmployeeResponse> update(
            @PathVariable String employeeId,
            @Valid @RequestBody UpdateEmployeeRequest request
    ) {
        return ResponseEntity.ok(employeeService.updateEmployee(employeeId, request));
    }

    @DeleteMapping("/{employeeId}")
    public ResponseEntity<Void> delete(@PathVariable String employeeId) {
        employeeService.deleteEmployee(employeeId);
        return ResponseEntity.noContent().build();
    }
}
