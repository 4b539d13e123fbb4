package com.numbertrack.backend.modules.employee.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.numbertrack.backend.global.common.PhoneNumberFormat;
import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmployeeScope;
import com.numbertrack.backend.modules.employee.domain.EmployeeStatusChangedEvent;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.numbertrack.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.numbertrack.backend.modules.employee.presentation.dto.EmployeePageResponse;
import com.numbertrack.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.numbertrack.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EmployeeService implements EmployeeDirectory {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final EmployeeRepository employeeRepository;
    private final EmployeeIdAllocator employeeIdAllocator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EmployeeService(
            EmployeeRepository employeeRepository,
            EmployeeIdAllocator employeeIdAllocator,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.employeeRepository = employeeRepository;
        this.employeeIdAllocator = employeeIdAllocator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public EmployeeResponse createEmployee(CreateEmployeeRequest request) {
        Employee employee = new Employee();
        employee.setEmployeeId(employeeIdAllocator.allocate());
        employee.setFullName(request.fullName().trim());
        if (request.phoneNumber() != null && !request.phoneNumber().isBlank()) {
            employee.setPhoneNumber(PhoneNumberFormat.requireValid(request.phoneNumber()));
        }
        employee.setEmail(trimToNull(request.email()));
        employee.setDepartment(trimToNull(request.department()));
        employee.setHireDate(request.hireDate());
        employee.setEmploymentStatus(EmploymentStatus.ACTIVE);

        Employee saved = employeeRepository.save(employee);
        log.info("employee created employeeId={}", saved.getEmployeeId());
        return EmployeeResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public EmployeePageResponse listEmployees(int page, int size, String search, String employmentStatus) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        EmploymentStatus status = parseStatus(employmentStatus);
        String pattern = search == null || search.isBlank()
                ? "%"
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";

        Page<Employee> result = employeeRepository.search(
                pattern,
                status,
                PageRequest.of(safePage - 1, safeSize, Sort.by(Sort.Direction.ASC, "employeeId"))
        );
        return new EmployeePageResponse(
                result.getContent().stream().map(EmployeeResponse::from).toList(),
                safePage,
                safeSize,
                result.getTotalElements()
        );
    }

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployee(String employeeId) {
        return EmployeeResponse.from(getByEmployeeId(employeeId));
    }

    public EmployeeResponse updateEmployee(String employeeId, UpdateEmployeeRequest request) {
        Employee employee = getByEmployeeId(employeeId);
        boolean changed = false;

        if (request.department() != null) {
            employee.setDepartment(trimToNull(request.department()));
            changed = true;
        }
        if (request.email() != null) {
            employee.setEmail(trimToNull(request.email()));
            changed = true;
        }
        if (request.hireDate() != null) {
            employee.setHireDate(request.hireDate());
            changed = true;
        }

        if (request.employmentStatus() != null) {
            EmploymentStatus previous = employee.getEmploymentStatus();
            EmploymentStatus next = request.employmentStatus();
            employee.setEmploymentStatus(next);
            if (next == EmploymentStatus.DEPARTED) {
                employee.setTerminationDate(request.terminationDate() != null
                        ? request.terminationDate()
                        : LocalDate.now(clock));
            } else {
                employee.setTerminationDate(null);
            }
            if (previous != next) {
                eventPublisher.publishEvent(new EmployeeStatusChangedEvent(employee.getEmployeeId(), previous, next, false));
                log.info("employee status changed employeeId={} {} -> {}", employee.getEmployeeId(), previous, next);
            }
            changed = true;
        } else if (request.terminationDate() != null) {
            employee.setTerminationDate(request.terminationDate());
            changed = true;
        }

        if (!changed) {
            throw ProblemException.badRequest("NO_FIELDS_TO_UPDATE", "no updatable field was provided");
        }
        return EmployeeResponse.from(employeeRepository.save(employee));
    }

    public void deleteEmployee(String employeeId) {
        Employee employee = getByEmployeeId(employeeId);
        eventPublisher.publishEvent(new EmployeeStatusChangedEvent(
                employee.getEmployeeId(),
                employee.getEmploymentStatus(),
                employee.getEmploymentStatus(),
                true
        ));
        employee.markDeleted(OffsetDateTime.now(clock));
        employeeRepository.save(employee);
        log.info("employee soft-deleted employeeId={}", employee.getEmployeeId());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Employee> findByEmployeeId(String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            return Optional.empty();
        }
        return employeeRepository.findActiveRecord(employeeId.trim());
    }

    @Override
    @Transactional(readOnly = true)
    public Employee getByEmployeeId(String employeeId) {
        return findByEmployeeId(employeeId)
                .orElseThrow(() -> ProblemException.notFound("EMPLOYEE_NOT_FOUND",
                        "employee %s does not exist".formatted(employeeId)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Employee> findActiveByScope(EmployeeScope scope) {
        return switch (scope.type()) {
            case ALL -> employeeRepository.findAllByStatus(EmploymentStatus.ACTIVE);
            case DEPARTMENTS -> scope.values().isEmpty()
                    ? List.of()
                    : employeeRepository.findAllByStatusAndDepartmentIn(EmploymentStatus.ACTIVE, scope.values());
            case EMPLOYEE_IDS -> scope.values().isEmpty()
                    ? List.of()
                    : employeeRepository.findAllByStatusAndEmployeeIdIn(EmploymentStatus.ACTIVE, scope.values());
        };
    }

    private EmploymentStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return EmploymentStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_EMPLOYMENT_STATUS", ex.getMessage());
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
