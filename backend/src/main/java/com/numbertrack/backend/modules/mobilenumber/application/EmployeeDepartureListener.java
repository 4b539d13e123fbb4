package com.numbertrack.backend.modules.mobilenumber.application;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.audit.application.AuditLogService;
import com.numbertrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.numbertrack.backend.modules.employee.domain.EmployeeStatusChangedEvent;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumber;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves the numbers a departing employee applied for into {@code risk_pending}. Runs inside the
 * employee update transaction, so a rejection here rolls back the status change as well.
 */
@Component
public class EmployeeDepartureListener {

    private static final Logger log = LoggerFactory.getLogger(EmployeeDepartureListener.class);

    private static final EnumSet<MobileNumberStatus> NOT_FLAGGABLE = EnumSet.of(
            MobileNumberStatus.DEACTIVATED,
            MobileNumberStatus.RISK_PENDING,
            MobileNumberStatus.USER_REPORTED
    );

    private final MobileNumberRepository mobileNumberRepository;
    private final AuditLogService auditLogService;

    public EmployeeDepartureListener(MobileNumberRepository mobileNumberRepository, AuditLogService auditLogService) {
        this.mobileNumberRepository = mobileNumberRepository;
        this.auditLogService = auditLogService;
    }

    @EventListener
    @Transactional
    public void onEmployeeStatusChanged(EmployeeStatusChangedEvent event) {
        if (!event.isDeparture()) {
            return;
        }
        String employeeId = event.employeeId();
        long held = mobileNumberRepository.countHeldByEmployeeWithStatus(employeeId, MobileNumberStatus.IN_USE);
        if (held > 0) {
            throw new ProblemException(
                    HttpStatus.CONFLICT,
                    "EMPLOYEE_HAS_ACTIVE_NUMBERS",
                    "employee %s still holds %d in_use number(s); reclaim them first".formatted(employeeId, held)
            );
        }

        List<MobileNumber> applied = mobileNumberRepository.findByApplicantForUpdate(employeeId, NOT_FLAGGABLE);
        for (MobileNumber number : applied) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("previousStatus", number.getStatus().getValue());
            detail.put("applicantEmployeeId", employeeId);
            number.setStatus(MobileNumberStatus.RISK_PENDING);
            auditLogService.record(AuditLogCommand.of(
                    "MOBILE_NUMBER_RISK_FLAGGED", MobileNumberService.RESOURCE_TYPE, number.getPhoneNumber(), detail));
        }
        if (!applied.isEmpty()) {
            log.info("departure flagged numbers employee={} count={}", employeeId, applied.size());
        }
    }
}
