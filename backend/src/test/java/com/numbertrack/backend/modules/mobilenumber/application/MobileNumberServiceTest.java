package com.numbertrack.backend.modules.mobilenumber.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.audit.application.AuditLogService;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumber;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.NumberUsageHistory;
import com.numbertrack.backend.modules.mobilenumber.domain.RiskAction;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberQueryRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.NumberApplicantHistoryRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.NumberUsageHistoryRepository;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.AssignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.HandleRiskRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UnassignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UpdateMobileNumberRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MobileNumberServiceTest {

    private static final String PHONE = "13800138000";

    @Mock
    private MobileNumberRepository mobileNumberRepository;

    @Mock
    private MobileNumberQueryRepository mobileNumberQueryRepository;

    @Mock
    private NumberUsageHistoryRepository usageHistoryRepository;

    @Mock
    private NumberApplicantHistoryRepository applicantHistoryRepository;

    @Mock
    private EmployeeDirectory employeeDirectory;

    @Mock
    private AuditLogService auditLogService;

    private MobileNumberService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-05-20T03:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new MobileNumberService(
                mobileNumberRepository,
                mobileNumberQueryRepository,
                usageHistoryRepository,
                applicantHistoryRepository,
                employeeDirectory,
                auditLogService,
                clock);
    }

    @Test
    void assigningAHeldNumberConflicts() {
        MobileNumber number = number(MobileNumberStatus.IN_USE, "EMP0000002");
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE)).thenReturn(Optional.of(number));

        assertProblem(() -> service.assignNumber(PHONE, new AssignMobileNumberRequest("EMP0000003", LocalDate.now(), null)),
                HttpStatus.CONFLICT, "MOBILE_NUMBER_NOT_IDLE");
        verify(usageHistoryRepository, never()).save(any());
    }

    @Test
    void assigningToAnInactiveEmployeeIsUnprocessable() {
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE))
                .thenReturn(Optional.of(number(MobileNumberStatus.IDLE, null)));
        when(employeeDirectory.getByEmployeeId("EMP0000003"))
                .thenReturn(employee("EMP0000003", EmploymentStatus.INACTIVE));

        assertProblem(() -> service.assignNumber(PHONE, new AssignMobileNumberRequest("EMP0000003", LocalDate.now(), null)),
                HttpStatus.UNPROCESSABLE_ENTITY, "EMPLOYEE_NOT_ACTIVE");
    }

    @Test
    void reclaimWithSeveralOpenIntervalsIsReportedAsInconsistent() {
        MobileNumber number = number(MobileNumberStatus.IN_USE, "EMP0000002");
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE)).thenReturn(Optional.of(number));
        when(usageHistoryRepository.findOpenIntervals(number.getId(), "EMP0000002")).thenReturn(List.of(
                NumberUsageHistory.open(number, "EMP0000002", LocalDate.of(2025, 1, 1)),
                NumberUsageHistory.open(number, "EMP0000002", LocalDate.of(2025, 2, 1))));

        assertProblem(() -> service.unassignNumber(PHONE, new UnassignMobileNumberRequest(null)),
                HttpStatus.INTERNAL_SERVER_ERROR, "DATA_INCONSISTENCY");
        assertThat(number.getStatus()).isEqualTo(MobileNumberStatus.IN_USE);
    }

    @Test
    void reclaimWithoutAnOpenIntervalIsReportedAsInconsistent() {
        MobileNumber number = number(MobileNumberStatus.IN_USE, "EMP0000002");
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE)).thenReturn(Optional.of(number));
        when(usageHistoryRepository.findOpenIntervals(number.getId(), "EMP0000002")).thenReturn(List.of());

        assertProblem(() -> service.unassignNumber(PHONE, new UnassignMobileNumberRequest(null)),
                HttpStatus.INTERNAL_SERVER_ERROR, "DATA_INCONSISTENCY");
        assertThat(number.getStatus()).isEqualTo(MobileNumberStatus.IN_USE);
        assertThat(number.getCurrentEmployeeId()).isEqualTo("EMP0000002");
        verify(usageHistoryRepository, never()).save(any());
    }

    @Test
    void statusPatchOnAHeldNumberRequiresUnassign() {
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE))
                .thenReturn(Optional.of(number(MobileNumberStatus.USER_REPORTED, "EMP0000002")));

        assertProblem(() -> service.updateNumber(PHONE, new UpdateMobileNumberRequest(MobileNumberStatus.IDLE, null, null, null)),
                HttpStatus.CONFLICT, "UNASSIGN_REQUIRED");
    }

    @Test
    void emptyPatchIsRejected() {
        when(mobileNumberRepository.findByPhoneNumberForUpdate(PHONE))
                .thenReturn(Optional.of(number(MobileNumberStatus.IDLE, null)));

        assertProblem(() -> service.updateNumber(PHONE, new UpdateMobileNumberRequest(null, null, null, null)),
                HttpStatus.BAD_REQUEST, "NO_FIELDS_TO_UPDATE");
    }

    @Test
    void riskHandlingNeedsAnActiveOperator() {
        when(employeeDirectory.findByEmployeeId("EMP0000009"))
                .thenReturn(Optional.of(employee("EMP0000009", EmploymentStatus.DEPARTED)));

        assertProblem(() -> service.handleRisk(PHONE, new HandleRiskRequest(RiskAction.RECLAIM, null, null), "EMP0000009"),
                HttpStatus.UNPROCESSABLE_ENTITY, "OPERATOR_NOT_ACTIVE");
        verify(mobileNumberRepository, never()).findByPhoneNumberForUpdate(any());
    }

    @Test
    void confirmingSomeoneElsesNumberIsRejected() {
        UUID id = UUID.randomUUID();
        when(mobileNumberRepository.findByIdForUpdate(id))
                .thenReturn(Optional.of(number(MobileNumberStatus.IN_USE, "EMP0000002")));

        assertProblem(() -> service.confirmUsage(id, "EMP0000001", null),
                HttpStatus.BAD_REQUEST, "NUMBER_NOT_HELD_BY_EMPLOYEE");
    }

    @Test
    void reportingFlagsTheNumberButKeepsTheHolder() {
        UUID id = UUID.randomUUID();
        MobileNumber number = number(MobileNumberStatus.IN_USE, "EMP0000001");
        when(mobileNumberRepository.findByIdForUpdate(id)).thenReturn(Optional.of(number));

        service.reportIssue(id, "EMP0000001");

        assertThat(number.getStatus()).isEqualTo(MobileNumberStatus.USER_REPORTED);
        assertThat(number.getCurrentEmployeeId()).isEqualTo("EMP0000001");
        verify(auditLogService).record(any());
    }

    @Test
    void clearingAReportSettlesBackToInUse() {
        UUID id = UUID.randomUUID();
        MobileNumber number = number(MobileNumberStatus.USER_REPORTED, "EMP0000001");
        when(mobileNumberRepository.findByIdForUpdate(id)).thenReturn(Optional.of(number));

        service.clearUserReport(id);

        assertThat(number.getStatus()).isEqualTo(MobileNumberStatus.IN_USE);
    }

    private static void assertProblem(Runnable call, HttpStatus status, String code) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(status);
                    assertThat(ex.getCode()).isEqualTo(code);
                });
    }

    private static MobileNumber number(MobileNumberStatus status, String holder) {
        MobileNumber number = new MobileNumber();
        number.setPhoneNumber(PHONE);
        number.setApplicantEmployeeId("EMP0000001");
        number.setApplicationDate(LocalDate.of(2024, 12, 1));
        if (holder != null) {
            number.assignTo(holder);
        }
        number.setStatus(status);
        return number;
    }

    private static Employee employee(String employeeId, EmploymentStatus status) {
        Employee employee = new Employee();
        employee.setEmployeeId(employeeId);
        employee.setFullName("Employee " + employeeId);
        employee.setEmploymentStatus(status);
        return employee;
    }
}
