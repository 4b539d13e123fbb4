package com.numbertrack.backend.modules.verification.application;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.global.error.RetryableProblemException;
import com.numbertrack.backend.modules.audit.application.AuditLogService;
import com.numbertrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmployeeScope;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchTask;
import com.numbertrack.backend.modules.verification.domain.VerificationScopeType;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationBatchTaskRepository;
import com.numbertrack.backend.modules.verification.presentation.dto.BatchStatusResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.InitiateVerificationRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.InitiateVerificationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Starts verification campaigns and reports their progress.
 *
 * <p>{@link #initiate} runs without a surrounding transaction; the worker thread only sees committed task rows.
 */
@Service
public class VerificationBatchService {

    private static final Logger log = LoggerFactory.getLogger(VerificationBatchService.class);

    static final String RESOURCE_TYPE = "VERIFICATION_BATCH";
    private static final Duration QUEUE_FULL_RETRY_AFTER = Duration.ofSeconds(30);

    private final VerificationBatchTaskRepository taskRepository;
    private final EmployeeDirectory employeeDirectory;
    private final VerificationBatchQueue queue;
    private final BatchProgressRecorder recorder;
    private final AuditLogService auditLogService;
    private final int defaultDurationDays;

    public VerificationBatchService(
            VerificationBatchTaskRepository taskRepository,
            EmployeeDirectory employeeDirectory,
            VerificationBatchQueue queue,
            BatchProgressRecorder recorder,
            AuditLogService auditLogService,
            @Value("${app.verification.default-duration-days:7}") int defaultDurationDays
    ) {
        this.taskRepository = taskRepository;
        this.employeeDirectory = employeeDirectory;
        this.queue = queue;
        this.recorder = recorder;
        this.auditLogService = auditLogService;
        this.defaultDurationDays = defaultDurationDays;
    }

    public InitiateVerificationResponse initiate(InitiateVerificationRequest request, UUID initiatedBy) {
        VerificationScopeType scopeType = request.scope();
        int durationDays = request.durationDays() != null ? request.durationDays() : defaultDurationDays;
        EmployeeScope scope = toEmployeeScope(scopeType, request.scopeValues());

        List<Employee> employees = employeeDirectory.findActiveByScope(scope);
        if (employees.isEmpty()) {
            throw ProblemException.notFound("NO_EMPLOYEES_IN_SCOPE",
                    "no active employee matches scope %s %s".formatted(scopeType.getValue(), scope.values()));
        }

        VerificationBatchTask task = taskRepository.save(
                VerificationBatchTask.create(scopeType, scope.values(), durationDays, employees.size(), initiatedBy));
        try {
            queue.enqueue(task.getId());
        } catch (TaskRejectedException ex) {
            log.warn("[ALERT][VerificationBatch] task={} rejected by worker pool", task.getId());
            recorder.fail(task.getId(), "Worker queue full");
            throw new RetryableProblemException("VERIFICATION_QUEUE_FULL",
                    "too many verification batches are running, try again later", QUEUE_FULL_RETRY_AFTER);
        }

        auditLogService.record(AuditLogCommand.of("VERIFICATION_INITIATE", RESOURCE_TYPE, task.getId().toString(), Map.of(
                "scope", scopeType.getValue(),
                "scopeValues", scope.values(),
                "durationDays", durationDays,
                "totalEmployees", employees.size())));
        log.info("verification batch queued task={} scope={} employees={}", task.getId(), scopeType.getValue(), employees.size());
        return new InitiateVerificationResponse(task.getId(), task.getStatus(), employees.size());
    }

    @Transactional(readOnly = true)
    public BatchStatusResponse getBatchStatus(UUID batchId) {
        return taskRepository.findById(batchId)
                .map(BatchStatusResponse::from)
                .orElseThrow(() -> ProblemException.notFound("BATCH_NOT_FOUND",
                        "verification batch %s does not exist".formatted(batchId)));
    }

    private EmployeeScope toEmployeeScope(VerificationScopeType scopeType, List<String> rawValues) {
        List<String> values = rawValues == null ? List.of() : rawValues;
        EmployeeScope scope = switch (scopeType) {
            case ALL_USERS -> EmployeeScope.all();
            case DEPARTMENT -> EmployeeScope.departments(values);
            case EMPLOYEE_IDS -> EmployeeScope.employeeIds(values);
        };
        if (scopeType != VerificationScopeType.ALL_USERS && scope.values().isEmpty()) {
            throw ProblemException.badRequest("SCOPE_VALUES_REQUIRED",
                    "scopeValues must not be empty for scope %s".formatted(scopeType.getValue()));
        }
        return scope;
    }
}
