package com.numbertrack.backend.modules.verification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmployeeScope;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.verification.application.BatchProgressRecorder.BatchRun;
import com.numbertrack.backend.modules.verification.application.VerificationMailSender.VerificationMail;
import com.numbertrack.backend.modules.verification.domain.BatchFailure;
import com.numbertrack.backend.modules.verification.domain.VerificationScopeType;
import com.numbertrack.backend.modules.verification.domain.VerificationToken;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class VerificationBatchWorkerTest {

    private static final UUID TASK_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private BatchProgressRecorder recorder;

    @Mock
    private EmployeeDirectory employeeDirectory;

    @Mock
    private VerificationMailSender mailSender;

    private VerificationBatchWorker worker;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        worker = new VerificationBatchWorker(recorder, employeeDirectory, mailSender, clock, "https://numbers.example.com/", 2);
    }

    @Test
    @DisplayName("an employee without an address still gets a token but counts as a failed delivery")
    void missingAddressIsRecordedAsFailure() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        Employee bob = employee("EMP0000002", "Bob", null);
        Employee carol = employee("EMP0000003", "Carol", "carol@example.com");
        givenRun(VerificationScopeType.DEPARTMENT, List.of("Sales"), List.of(alice, bob, carol));

        worker.run(TASK_ID);

        verify(recorder, times(3)).issueToken(eq(TASK_ID), anyString(), eq(OffsetDateTime.now(clock).plusDays(3)));
        verify(recorder, times(2)).recordEmailSucceeded(eq(TASK_ID), any());
        verify(recorder).recordEmailFailed(TASK_ID, tokenId("EMP0000002"),
                new BatchFailure("EMP0000002", "Bob", "N/A", "Missing email address"));
        verify(recorder).complete(TASK_ID);
        verify(mailSender, times(2)).send(any());
        assertThat(MDC.get(VerificationBatchWorker.BATCH_ID_MDC_KEY)).isNull();
    }

    @Test
    void mailIsRetriedUpToTheConfiguredAttempts() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        givenRun(VerificationScopeType.EMPLOYEE_IDS, List.of("EMP0000001"), List.of(alice));
        doThrow(new IllegalStateException("connection refused")).when(mailSender).send(any());

        worker.run(TASK_ID);

        verify(mailSender, times(2)).send(any());
        verify(recorder).recordEmailFailed(TASK_ID, tokenId("EMP0000001"),
                new BatchFailure("EMP0000001", "Alice", "alice@example.com", "connection refused"));
        verify(recorder, never()).recordEmailSucceeded(any(), any());
        verify(recorder).complete(TASK_ID);
    }

    @Test
    void mailCarriesTheVerificationLinkAndExpiry() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        givenRun(VerificationScopeType.ALL_USERS, List.of(), List.of(alice));

        worker.run(TASK_ID);

        ArgumentCaptor<VerificationMail> mail = ArgumentCaptor.forClass(VerificationMail.class);
        verify(mailSender).send(mail.capture());
        assertThat(mail.getValue().toAddress()).isEqualTo("alice@example.com");
        assertThat(mail.getValue().verificationLink())
                .isEqualTo("https://numbers.example.com/verify-numbers?token=token-EMP0000001");
        assertThat(mail.getValue().expiresAt()).isEqualTo(OffsetDateTime.now(clock).plusDays(3));
    }

    @Test
    void resumedRunSkipsEmployeesWhoseDeliveryWasAlreadyRecorded() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        Employee carol = employee("EMP0000003", "Carol", "carol@example.com");
        givenRun(VerificationScopeType.DEPARTMENT, List.of("Sales"), List.of(alice, carol));
        VerificationToken delivered = token("EMP0000001");
        delivered.markDelivered();
        when(recorder.findToken(eq(TASK_ID), anyString())).thenAnswer(invocation ->
                "EMP0000001".equals(invocation.getArgument(1)) ? Optional.of(delivered) : Optional.empty());

        worker.run(TASK_ID);

        verify(recorder, never()).issueToken(eq(TASK_ID), eq("EMP0000001"), any());
        verify(recorder).issueToken(eq(TASK_ID), eq("EMP0000003"), any());
        verify(recorder, times(1)).recordEmailSucceeded(eq(TASK_ID), any());
        verify(recorder).recordEmailSucceeded(TASK_ID, tokenId("EMP0000003"));
        verify(mailSender, times(1)).send(any());
        verify(recorder).complete(TASK_ID);
    }

    @Test
    @DisplayName("a token stored before a crash but never mailed is mailed on resume without issuing another")
    void resumedRunMailsTokenThatHasNoDeliveryOutcome() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        when(recorder.begin(TASK_ID)).thenReturn(Optional.of(run(VerificationScopeType.DEPARTMENT, List.of("Sales"), 1)));
        when(employeeDirectory.findActiveByScope(any())).thenReturn(List.of(alice));
        when(recorder.findToken(TASK_ID, "EMP0000001")).thenReturn(Optional.of(token("EMP0000001")));

        worker.run(TASK_ID);

        verify(recorder, never()).issueToken(any(), any(), any());
        ArgumentCaptor<VerificationMail> mail = ArgumentCaptor.forClass(VerificationMail.class);
        verify(mailSender).send(mail.capture());
        assertThat(mail.getValue().verificationLink()).endsWith("?token=token-EMP0000001");
        verify(recorder).recordEmailSucceeded(TASK_ID, tokenId("EMP0000001"));
        verify(recorder).complete(TASK_ID);
    }

    @Test
    void resumedRunDoesNotRecountEarlierTokenFailures() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        Employee carol = employee("EMP0000003", "Carol", "carol@example.com");
        when(recorder.begin(TASK_ID)).thenReturn(Optional.of(new BatchRun(
                TASK_ID, VerificationScopeType.DEPARTMENT, List.of("Sales"), 3, 2, Set.of("EMP0000001"))));
        when(employeeDirectory.findActiveByScope(any())).thenReturn(List.of(alice, carol));
        when(recorder.issueToken(eq(TASK_ID), anyString(), any())).thenAnswer(invocation -> token(invocation.getArgument(1)));

        worker.run(TASK_ID);

        verify(recorder, never()).issueToken(eq(TASK_ID), eq("EMP0000001"), any());
        verify(recorder, never()).recordTokenFailed(any(), any());
        verify(recorder).recordEmailSucceeded(TASK_ID, tokenId("EMP0000003"));
        verify(recorder).complete(TASK_ID);
    }

    @Test
    void changedScopeKeepsTheInitiationTotal() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        when(recorder.begin(TASK_ID)).thenReturn(Optional.of(run(VerificationScopeType.DEPARTMENT, List.of("Sales"), 4)));
        when(employeeDirectory.findActiveByScope(any())).thenReturn(List.of(alice));
        when(recorder.issueToken(eq(TASK_ID), anyString(), any())).thenAnswer(invocation -> token(invocation.getArgument(1)));

        worker.run(TASK_ID);

        verify(recorder).recordEmailSucceeded(TASK_ID, tokenId("EMP0000001"));
        verify(recorder).complete(TASK_ID);
        verify(recorder, never()).fail(any(), any());
    }

    @Test
    void tokenFailureSkipsTheMailAndContinues() {
        Employee alice = employee("EMP0000001", "Alice", "alice@example.com");
        Employee carol = employee("EMP0000003", "Carol", "carol@example.com");
        givenRun(VerificationScopeType.DEPARTMENT, List.of("Sales"), List.of(alice, carol));
        when(recorder.issueToken(eq(TASK_ID), eq("EMP0000001"), any()))
                .thenThrow(new IllegalStateException("duplicate key"));

        worker.run(TASK_ID);

        verify(recorder).recordTokenFailed(TASK_ID,
                new BatchFailure("EMP0000001", "Alice", "N/A", "Token creation failed: duplicate key"));
        verify(mailSender, times(1)).send(any());
        verify(recorder).complete(TASK_ID);
    }

    @Test
    void scopeResolutionFailureFailsTheTask() {
        when(recorder.begin(TASK_ID)).thenReturn(Optional.of(
                run(VerificationScopeType.ALL_USERS, List.of(), 0)));
        when(employeeDirectory.findActiveByScope(any())).thenThrow(new IllegalStateException("db down"));

        worker.run(TASK_ID);

        verify(recorder).fail(eq(TASK_ID), startsWith("Failed to resolve target employees"));
        verify(recorder, never()).complete(any());
    }

    @Test
    void finishedTaskIsNotProcessedAgain() {
        when(recorder.begin(TASK_ID)).thenReturn(Optional.empty());

        worker.run(TASK_ID);

        verify(employeeDirectory, never()).findActiveByScope(any());
        verify(recorder, never()).complete(any());
    }

    @Test
    void batchScopeMapsOntoEmployeeScope() {
        EmployeeScope scope = VerificationBatchWorker.toEmployeeScope(
                new BatchRun(TASK_ID, VerificationScopeType.EMPLOYEE_IDS, List.of(" EMP0000001 ", "EMP0000001"), 7, 1, Set.of()));

        assertThat(scope.type()).isEqualTo(EmployeeScope.Type.EMPLOYEE_IDS);
        assertThat(scope.values()).containsExactly("EMP0000001");
    }

    private void givenRun(VerificationScopeType type, List<String> values, List<Employee> employees) {
        when(recorder.begin(TASK_ID)).thenReturn(Optional.of(run(type, values, employees.size())));
        when(employeeDirectory.findActiveByScope(any())).thenReturn(employees);
        when(recorder.issueToken(eq(TASK_ID), anyString(), any())).thenAnswer(invocation -> {
            VerificationToken token = VerificationToken.issue(
                    "token-" + invocation.getArgument(1),
                    invocation.getArgument(1),
                    TASK_ID,
                    invocation.getArgument(2));
            ReflectionTestUtils.setField(token, "id", tokenId(invocation.getArgument(1)));
            return token;
        });
    }

    private static BatchRun run(VerificationScopeType type, List<String> values, int totalEmployees) {
        return new BatchRun(TASK_ID, type, values, 3, totalEmployees, Set.of());
    }

    private VerificationToken token(String employeeId) {
        VerificationToken token = VerificationToken.issue(
                "token-" + employeeId, employeeId, TASK_ID, OffsetDateTime.now(clock).plusDays(3));
        ReflectionTestUtils.setField(token, "id", tokenId(employeeId));
        return token;
    }

    private static UUID tokenId(String employeeId) {
        return UUID.nameUUIDFromBytes(employeeId.getBytes(StandardCharsets.UTF_8));
    }

    private static Employee employee(String employeeId, String name, String email) {
        Employee employee = new Employee();
        employee.setEmployeeId(employeeId);
        employee.setFullName(name);
        employee.setEmail(email);
        employee.setDepartment("Sales");
        employee.setEmploymentStatus(EmploymentStatus.ACTIVE);
        return employee;
    }
}
