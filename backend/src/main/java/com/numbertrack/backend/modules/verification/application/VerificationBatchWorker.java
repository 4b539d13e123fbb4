package com.numbertrack.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.global.web.RequestIdFilter;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmployeeScope;
import com.numbertrack.backend.modules.verification.application.BatchProgressRecorder.BatchRun;
import com.numbertrack.backend.modules.verification.application.VerificationMailSender.VerificationMail;
import com.numbertrack.backend.modules.verification.domain.BatchFailure;
import com.numbertrack.backend.modules.verification.domain.VerificationToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs one batch task to a terminal status: one token and one email per employee, strictly in order.
 * Failures are recorded on the task and never thrown back to the caller.
 */
@Component
public class VerificationBatchWorker {

    private static final Logger log = LoggerFactory.getLogger(VerificationBatchWorker.class);

    public static final String BATCH_ID_MDC_KEY = "batchId";
    static final String MISSING_EMAIL = "Missing email address";
    static final String NO_ADDRESS = "N/A";

    private final BatchProgressRecorder recorder;
    private final EmployeeDirectory employeeDirectory;
    private final VerificationMailSender mailSender;
    private final Clock clock;
    private final String frontendBaseUrl;
    private final int maxMailAttempts;

    public VerificationBatchWorker(
            BatchProgressRecorder recorder,
            EmployeeDirectory employeeDirectory,
            VerificationMailSender mailSender,
            Clock clock,
            @Value("${app.frontend-base-url:http://localhost:3000}") String frontendBaseUrl,
            @Value("${app.verification.mail.max-attempts:2}") int maxMailAttempts
    ) {
        this.recorder = recorder;
        this.employeeDirectory = employeeDirectory;
        this.mailSender = mailSender;
        this.clock = clock;
        this.frontendBaseUrl = stripTrailingSlash(frontendBaseUrl);
        this.maxMailAttempts = Math.max(1, maxMailAttempts);
    }

    public void run(UUID taskId) {
        MDC.put(BATCH_ID_MDC_KEY, taskId.toString());
        MDC.remove(RequestIdFilter.REQUEST_ID_MDC_KEY);
        try {
            recorder.begin(taskId).ifPresentOrElse(
                    this::process,
                    () -> log.info("batch task already finished or missing, skipping"));
        } catch (RuntimeException ex) {
            log.error("[ALERT][VerificationBatch] task={} aborted: {}", taskId, ex.getMessage(), ex);
            markFailed(taskId, "Batch aborted: " + ex.getMessage());
        } finally {
            MDC.remove(BATCH_ID_MDC_KEY);
        }
    }

    private void process(BatchRun run) {
        UUID taskId = run.taskId();
        List<Employee> employees;
        try {
            employees = employeeDirectory.findActiveByScope(toEmployeeScope(run));
        } catch (RuntimeException ex) {
            log.error("[ALERT][VerificationBatch] task={} scope resolution failed: {}", taskId, ex.getMessage(), ex);
            markFailed(taskId, "Failed to resolve target employees: " + ex.getMessage());
            return;
        }
        if (employees.size() != run.totalEmployees()) {
            log.warn("[ALERT][VerificationBatch] task={} scope now resolves to {} employees, initiation counted {}",
                    taskId, employees.size(), run.totalEmployees());
        }
        log.info("batch started employees={} durationDays={}", employees.size(), run.durationDays());

        for (Employee employee : employees) {
            Optional<VerificationToken> existing = recorder.findToken(taskId, employee.getEmployeeId());
            if (existing.isPresent()) {
                VerificationToken token = existing.get();
                if (token.hasDeliveryOutcome()) {
                    continue;
                }
                // resumed run: token was stored but the mail outcome never was
                log.info("employee={} has an undelivered token from an earlier run", employee.getEmployeeId());
                deliver(taskId, employee, token);
            } else if (!run.failedEmployeeIds().contains(employee.getEmployeeId())) {
                processEmployee(run, employee);
            }
        }

        recorder.complete(taskId);
        log.info("batch finished task={}", taskId);
    }

    private void processEmployee(BatchRun run, Employee employee) {
        UUID taskId = run.taskId();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusDays(run.durationDays());

        VerificationToken token;
        try {
            token = recorder.issueToken(taskId, employee.getEmployeeId(), expiresAt);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][VerificationBatch] task={} employee={} token creation failed: {}",
                    taskId, employee.getEmployeeId(), ex.getMessage(), ex);
            recorder.recordTokenFailed(taskId, failure(employee, NO_ADDRESS, "Token creation failed: " + ex.getMessage()));
            return;
        }
        deliver(taskId, employee, token);
    }

    private void deliver(UUID taskId, Employee employee, VerificationToken token) {
        if (!employee.hasEmail()) {
            log.info("employee={} has no email address, counted as failed delivery", employee.getEmployeeId());
            recorder.recordEmailFailed(taskId, token.getId(), failure(employee, NO_ADDRESS, MISSING_EMAIL));
            return;
        }

        VerificationMail mail = new VerificationMail(
                employee.getEmail(), employee.getFullName(), verificationLink(token.getToken()), token.getExpiresAt());
        String error = sendWithRetry(taskId, employee, mail);
        if (error == null) {
            recorder.recordEmailSucceeded(taskId, token.getId());
        } else {
            recorder.recordEmailFailed(taskId, token.getId(), failure(employee, employee.getEmail(), error));
        }
    }

    /**
     * @return {@code null} on success, otherwise the last failure message
     */
    private String sendWithRetry(UUID taskId, Employee employee, VerificationMail mail) {
        String lastError = null;
        for (int attempt = 1; attempt <= maxMailAttempts; attempt++) {
            try {
                mailSender.send(mail);
                return null;
            } catch (RuntimeException ex) {
                lastError = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                log.warn("[ALERT][VerificationBatch] task={} employee={} attempt={}/{} mail failed: {}",
                        taskId, employee.getEmployeeId(), attempt, maxMailAttempts, lastError);
            }
        }
        return lastError;
    }

    String verificationLink(String token) {
        return frontendBaseUrl + "/verify-numbers?token=" + token;
    }

    private void markFailed(UUID taskId, String reason) {
        try {
            recorder.fail(taskId, reason);
        } catch (RuntimeException inner) {
            log.error("[ALERT][VerificationBatch] task={} could not be marked failed", taskId, inner);
        }
    }

    static EmployeeScope toEmployeeScope(BatchRun run) {
        return switch (run.scopeType()) {
            case ALL_USERS -> EmployeeScope.all();
            case DEPARTMENT -> EmployeeScope.departments(run.scopeValues());
            case EMPLOYEE_IDS -> EmployeeScope.employeeIds(run.scopeValues());
        };
    }

    private static BatchFailure failure(Employee employee, String address, String reason) {
        return new BatchFailure(employee.getEmployeeId(), employee.getFullName(), address, reason);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
