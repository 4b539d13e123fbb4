package com.numbertrack.backend.modules.mobilenumber.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.numbertrack.backend.global.common.PhoneNumberFormat;
import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.audit.application.AuditLogService;
import com.numbertrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumber;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.NumberApplicantHistory;
import com.numbertrack.backend.modules.mobilenumber.domain.NumberUsageHistory;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberQueryRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberQueryRepository.NumberSearchCriteria;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberQueryRepository.PageSlice;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.MobileNumberRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.NumberApplicantHistoryRepository;
import com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence.NumberUsageHistoryRepository;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.AssignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.CreateMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.HandleRiskRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberDetailResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberPageResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UnassignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UpdateMobileNumberRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * State transitions of company numbers. Mutations that touch a number and its history run in one
 * transaction holding a row lock on the number.
 */
@Service
@Transactional
public class MobileNumberService {

    private static final Logger log = LoggerFactory.getLogger(MobileNumberService.class);

    static final String RESOURCE_TYPE = "MOBILE_NUMBER";
    private static final int MAX_PAGE_SIZE = 100;

    private final MobileNumberRepository mobileNumberRepository;
    private final MobileNumberQueryRepository mobileNumberQueryRepository;
    private final NumberUsageHistoryRepository usageHistoryRepository;
    private final NumberApplicantHistoryRepository applicantHistoryRepository;
    private final EmployeeDirectory employeeDirectory;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MobileNumberService(
            MobileNumberRepository mobileNumberRepository,
            MobileNumberQueryRepository mobileNumberQueryRepository,
            NumberUsageHistoryRepository usageHistoryRepository,
            NumberApplicantHistoryRepository applicantHistoryRepository,
            EmployeeDirectory employeeDirectory,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.mobileNumberRepository = mobileNumberRepository;
        this.mobileNumberQueryRepository = mobileNumberQueryRepository;
        this.usageHistoryRepository = usageHistoryRepository;
        this.applicantHistoryRepository = applicantHistoryRepository;
        this.employeeDirectory = employeeDirectory;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public MobileNumberResponse createNumber(CreateMobileNumberRequest request) {
        String phone = PhoneNumberFormat.requireValid(request.phoneNumber());
        Employee applicant = employeeDirectory.findByEmployeeId(request.applicantEmployeeId())
                .orElseThrow(() -> ProblemException.notFound("APPLICANT_NOT_FOUND",
                        "applicant %s does not exist".formatted(request.applicantEmployeeId())));
        if (mobileNumberRepository.existsByPhoneNumber(phone)) {
            throw duplicate(phone);
        }

        MobileNumber number = new MobileNumber();
        number.setPhoneNumber(phone);
        number.setApplicantEmployeeId(applicant.getEmployeeId());
        number.setApplicationDate(request.applicationDate());
        number.setPurpose(trimToNull(request.purpose()));
        number.setVendor(trimToNull(request.vendor()));
        number.setRemarks(trimToNull(request.remarks()));
        number.setStatus(MobileNumberStatus.IDLE);
        try {
            mobileNumberRepository.saveAndFlush(number);
        } catch (DataIntegrityViolationException ex) {
            throw duplicate(phone);
        }

        audit("MOBILE_NUMBER_CREATE", phone, detail("applicantEmployeeId", applicant.getEmployeeId()));
        log.info("mobile number created phone={} applicant={}", phone, applicant.getEmployeeId());
        return view(phone);
    }

    @Transactional(readOnly = true)
    public MobileNumberPageResponse listNumbers(
            int page,
            int size,
            String sortBy,
            String sortOrder,
            String search,
            String status,
            String applicantStatus
    ) {
        MobileNumberStatus statusFilter = parseStatus(status);
        if (statusFilter == MobileNumberStatus.RISK_PENDING) {
            // risk_pending numbers are only listed through the dedicated risk view
            return new MobileNumberPageResponse(List.of(), safePage(page), safeSize(size), 0);
        }
        NumberSearchCriteria criteria = new NumberSearchCriteria(
                safePage(page),
                safeSize(size),
                sortBy,
                sortOrder,
                search,
                statusFilter,
                MobileNumberStatus.RISK_PENDING,
                parseEmploymentStatus(applicantStatus)
        );
        return toPage(criteria, mobileNumberQueryRepository.search(criteria));
    }

    @Transactional(readOnly = true)
    public MobileNumberPageResponse listRiskPendingNumbers(
            int page,
            int size,
            String sortBy,
            String sortOrder,
            String search,
            String applicantStatus
    ) {
        NumberSearchCriteria criteria = new NumberSearchCriteria(
                safePage(page),
                safeSize(size),
                sortBy,
                sortOrder,
                search,
                MobileNumberStatus.RISK_PENDING,
                null,
                parseEmploymentStatus(applicantStatus)
        );
        return toPage(criteria, mobileNumberQueryRepository.search(criteria));
    }

    @Transactional(readOnly = true)
    public MobileNumberDetailResponse getNumber(String phoneNumber) {
        MobileNumberResponse number = view(phoneNumber);
        List<MobileNumberDetailResponse.UsageInterval> usage = usageHistoryRepository.findByMobileNumberId(number.id())
                .stream()
                .map(history -> new MobileNumberDetailResponse.UsageInterval(
                        history.getEmployeeId(), history.getStartDate(), history.getEndDate()))
                .toList();
        List<MobileNumberDetailResponse.ApplicantChange> applicants = applicantHistoryRepository.findByMobileNumberId(number.id())
                .stream()
                .map(history -> new MobileNumberDetailResponse.ApplicantChange(
                        history.getPreviousApplicantEmployeeId(),
                        history.getNewApplicantEmployeeId(),
                        history.getChangeDate(),
                        history.getOperatorEmployeeId(),
                        history.getRemarks()))
                .toList();
        return new MobileNumberDetailResponse(number, usage, applicants);
    }

    public MobileNumberResponse assignNumber(String phoneNumber, AssignMobileNumberRequest request) {
        MobileNumber number = lockNumber(phoneNumber);
        if (number.getStatus() != MobileNumberStatus.IDLE) {
            throw ProblemException.conflict("MOBILE_NUMBER_NOT_IDLE",
                    "number %s is %s, only idle numbers can be assigned".formatted(phoneNumber, number.getStatus().getValue()));
        }
        Employee assignee = employeeDirectory.getByEmployeeId(request.employeeId());
        if (!assignee.getEmploymentStatus().isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "EMPLOYEE_NOT_ACTIVE",
                    "employee %s is %s".formatted(assignee.getEmployeeId(), assignee.getEmploymentStatus().getValue()));
        }

        number.assignTo(assignee.getEmployeeId());
        if (request.purpose() != null && !request.purpose().isBlank()) {
            number.setPurpose(request.purpose().trim());
        }
        usageHistoryRepository.save(NumberUsageHistory.open(number, assignee.getEmployeeId(), request.assignmentDate()));

        audit("MOBILE_NUMBER_ASSIGN", phoneNumber, detail(
                "employeeId", assignee.getEmployeeId(),
                "assignmentDate", request.assignmentDate().toString()));
        log.info("mobile number assigned phone={} employee={}", phoneNumber, assignee.getEmployeeId());
        return view(phoneNumber);
    }

    public MobileNumberResponse unassignNumber(String phoneNumber, UnassignMobileNumberRequest request) {
        LocalDate reclaimDate = request != null && request.reclaimDate() != null
                ? request.reclaimDate()
                : LocalDate.now(clock);
        MobileNumber number = lockNumber(phoneNumber);
        MobileNumberStatus previous = number.getStatus();

        if (previous == MobileNumberStatus.IN_USE) {
            closeOpenInterval(number, reclaimDate);
        } else if (previous.isFlagged()) {
            if (number.hasHolder()) {
                closeOpenInterval(number, reclaimDate);
            }
        } else {
            throw ProblemException.conflict("MOBILE_NUMBER_NOT_IN_USE",
                    "number %s is %s and has nothing to reclaim".formatted(phoneNumber, previous.getValue()));
        }
        String formerHolder = number.getCurrentEmployeeId();
        number.release();

        audit("MOBILE_NUMBER_UNASSIGN", phoneNumber, detail(
                "previousStatus", previous.getValue(),
                "employeeId", formerHolder,
                "reclaimDate", reclaimDate.toString()));
        log.info("mobile number reclaimed phone={} from={} previousStatus={}", phoneNumber, formerHolder, previous);
        return view(phoneNumber);
    }

    public MobileNumberResponse updateNumber(String phoneNumber, UpdateMobileNumberRequest request) {
        MobileNumber number = lockNumber(phoneNumber);
        Map<String, Object> changes = new LinkedHashMap<>();

        if (request.status() != null) {
            MobileNumberStatus target = request.status();
            if (target == MobileNumberStatus.IN_USE) {
                throw ProblemException.conflict("STATUS_REQUIRES_ASSIGN",
                        "use the assign operation to put a number in use");
            }
            if (number.getStatus() == MobileNumberStatus.IN_USE || number.hasHolder()) {
                throw ProblemException.conflict("UNASSIGN_REQUIRED",
                        "number %s is held by %s, unassign it first".formatted(phoneNumber, number.getCurrentEmployeeId()));
            }
            number.setStatus(target);
            if (target == MobileNumberStatus.DEACTIVATED) {
                number.setCancellationDate(LocalDate.now(clock));
            }
            changes.put("status", target.getValue());
        }
        if (request.purpose() != null) {
            number.setPurpose(trimToNull(request.purpose()));
            changes.put("purpose", number.getPurpose());
        }
        if (request.vendor() != null) {
            number.setVendor(trimToNull(request.vendor()));
            changes.put("vendor", number.getVendor());
        }
        if (request.remarks() != null) {
            number.setRemarks(trimToNull(request.remarks()));
            changes.put("remarks", number.getRemarks());
        }
        if (changes.isEmpty()) {
            throw ProblemException.badRequest("NO_FIELDS_TO_UPDATE", "no updatable field was provided");
        }

        audit("MOBILE_NUMBER_UPDATE", phoneNumber, changes);
        return view(phoneNumber);
    }

    public MobileNumberResponse handleRisk(String phoneNumber, HandleRiskRequest request, String operatorEmployeeId) {
        Employee operator = employeeDirectory.findByEmployeeId(operatorEmployeeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "OPERATOR_NOT_FOUND",
                        "operator %s is not a known employee".formatted(operatorEmployeeId)));
        if (!operator.getEmploymentStatus().isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "OPERATOR_NOT_ACTIVE",
                    "operator %s is not an active employee".formatted(operatorEmployeeId));
        }

        MobileNumber number = lockNumber(phoneNumber);
        if (number.getStatus() != MobileNumberStatus.RISK_PENDING) {
            throw ProblemException.conflict("MOBILE_NUMBER_NOT_RISK_PENDING",
                    "number %s is %s".formatted(phoneNumber, number.getStatus().getValue()));
        }

        LocalDate today = LocalDate.now(clock);
        String remarks = trimToNull(request.remarks());
        Map<String, Object> detail = detail(
                "action", request.action().getValue(),
                "operatorEmployeeId", operator.getEmployeeId(),
                "remarks", remarks);

        switch (request.action()) {
            case CHANGE_APPLICANT -> {
                Employee newApplicant = resolveNewApplicant(request.newApplicantEmployeeId());
                String previousApplicant = number.getApplicantEmployeeId();
                number.setApplicantEmployeeId(newApplicant.getEmployeeId());
                number.settle();
                applicantHistoryRepository.save(NumberApplicantHistory.record(
                        number, previousApplicant, newApplicant.getEmployeeId(), today, operator.getEmployeeId(), remarks));
                detail.put("previousApplicantEmployeeId", previousApplicant);
                detail.put("newApplicantEmployeeId", newApplicant.getEmployeeId());
            }
            case RECLAIM -> {
                if (number.hasHolder()) {
                    detail.put("employeeId", number.getCurrentEmployeeId());
                    closeOpenInterval(number, today);
                }
                number.release();
            }
            case DEACTIVATE -> {
                if (number.hasHolder()) {
                    detail.put("employeeId", number.getCurrentEmployeeId());
                    closeOpenInterval(number, today);
                }
                number.deactivate(today);
            }
        }
        if (remarks != null) {
            number.setRemarks(remarks);
        }

        audit("MOBILE_NUMBER_HANDLE_RISK", phoneNumber, detail);
        log.info("risk handled phone={} action={} operator={} status={}",
                phoneNumber, request.action().getValue(), operator.getEmployeeId(), number.getStatus());
        return view(phoneNumber);
    }

    @Transactional(readOnly = true)
    public List<MobileNumber> findHeldBy(String employeeId) {
        return mobileNumberRepository.findHeldByEmployee(employeeId);
    }

    /**
     * Stamps the confirmation time on a number the employee holds, optionally correcting its purpose.
     */
    public MobileNumber confirmUsage(UUID mobileNumberId, String employeeId, String purpose) {
        MobileNumber number = lockHeldNumber(mobileNumberId, employeeId);
        number.confirmUsage(OffsetDateTime.now(clock));
        if (purpose != null && !purpose.isBlank()) {
            number.setPurpose(purpose.trim());
        }
        return number;
    }

    /**
     * Flags a number the employee holds as disputed. The holder and open interval stay in place.
     */
    public MobileNumber reportIssue(UUID mobileNumberId, String employeeId) {
        MobileNumber number = lockHeldNumber(mobileNumberId, employeeId);
        if (number.getStatus() != MobileNumberStatus.USER_REPORTED) {
            audit("MOBILE_NUMBER_USER_REPORTED", number.getPhoneNumber(), detail(
                    "previousStatus", number.getStatus().getValue(),
                    "employeeId", employeeId));
            number.setStatus(MobileNumberStatus.USER_REPORTED);
        }
        return number;
    }

    /**
     * Returns a {@code user_reported} number to its settled status once its reports are closed.
     */
    public void clearUserReport(UUID mobileNumberId) {
        mobileNumberRepository.findByIdForUpdate(mobileNumberId)
                .filter(number -> number.getStatus() == MobileNumberStatus.USER_REPORTED)
                .ifPresent(number -> {
                    number.settle();
                    audit("MOBILE_NUMBER_REPORT_CLEARED", number.getPhoneNumber(), detail(
                            "status", number.getStatus().getValue()));
                });
    }

    private MobileNumber lockHeldNumber(UUID mobileNumberId, String employeeId) {
        MobileNumber number = mobileNumberRepository.findByIdForUpdate(mobileNumberId)
                .orElseThrow(() -> ProblemException.badRequest("NUMBER_NOT_HELD_BY_EMPLOYEE",
                        "number %s is not held by %s".formatted(mobileNumberId, employeeId)));
        if (!employeeId.equals(number.getCurrentEmployeeId()) || number.getStatus() == MobileNumberStatus.DEACTIVATED) {
            throw ProblemException.badRequest("NUMBER_NOT_HELD_BY_EMPLOYEE",
                    "number %s is not held by %s".formatted(mobileNumberId, employeeId));
        }
        return number;
    }

    private Employee resolveNewApplicant(String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            throw ProblemException.badRequest("NEW_APPLICANT_REQUIRED",
                    "newApplicantEmployeeId is required for change_applicant");
        }
        Employee newApplicant = employeeDirectory.getByEmployeeId(employeeId);
        if (!newApplicant.getEmploymentStatus().isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "EMPLOYEE_NOT_ACTIVE",
                    "new applicant %s is not active".formatted(employeeId));
        }
        return newApplicant;
    }

    private void closeOpenInterval(MobileNumber number, LocalDate endDate) {
        List<NumberUsageHistory> open = usageHistoryRepository.findOpenIntervals(number.getId(), number.getCurrentEmployeeId());
        if (open.size() != 1) {
            log.error("[DATA_INCONSISTENCY] phone={} holder={} openIntervals={}",
                    number.getPhoneNumber(), number.getCurrentEmployeeId(), open.size());
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "DATA_INCONSISTENCY",
                    "number %s has %d open usage intervals for holder %s, expected exactly one"
                            .formatted(number.getPhoneNumber(), open.size(), number.getCurrentEmployeeId()));
        }
        NumberUsageHistory interval = open.get(0);
        if (endDate.isBefore(interval.getStartDate())) {
            throw ProblemException.badRequest("RECLAIM_DATE_BEFORE_ASSIGNMENT",
                    "reclaim date %s is before assignment date %s".formatted(endDate, interval.getStartDate()));
        }
        interval.close(endDate);
    }

    private MobileNumber lockNumber(String phoneNumber) {
        return mobileNumberRepository.findByPhoneNumberForUpdate(phoneNumber)
                .orElseThrow(() -> notFound(phoneNumber));
    }

    private MobileNumberResponse view(String phoneNumber) {
        return mobileNumberQueryRepository.findViewByPhoneNumber(phoneNumber)
                .map(MobileNumberResponse::from)
                .orElseThrow(() -> notFound(phoneNumber));
    }

    private MobileNumberPageResponse toPage(NumberSearchCriteria criteria, PageSlice slice) {
        return new MobileNumberPageResponse(
                slice.items().stream().map(MobileNumberResponse::from).toList(),
                criteria.page(),
                criteria.size(),
                slice.totalCount()
        );
    }

    private void audit(String action, String phoneNumber, Map<String, Object> detail) {
        auditLogService.record(AuditLogCommand.of(action, RESOURCE_TYPE, phoneNumber, detail));
    }

    private static Map<String, Object> detail(Object... keyValues) {
        Map<String, Object> detail = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                detail.put(keyValues[i].toString(), keyValues[i + 1]);
            }
        }
        return detail;
    }

    private MobileNumberStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return MobileNumberStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_STATUS", ex.getMessage());
        }
    }

    private EmploymentStatus parseEmploymentStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return EmploymentStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_EMPLOYMENT_STATUS", ex.getMessage());
        }
    }

    private static int safePage(int page) {
        return Math.max(page, 1);
    }

    private static int safeSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private ProblemException notFound(String phoneNumber) {
        return ProblemException.notFound("MOBILE_NUMBER_NOT_FOUND", "number %s does not exist".formatted(phoneNumber));
    }

    private ProblemException duplicate(String phoneNumber) {
        return ProblemException.conflict("MOBILE_NUMBER_ALREADY_EXISTS", "number %s is already registered".formatted(phoneNumber));
    }
}
