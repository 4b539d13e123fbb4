package com.numbertrack.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.mobilenumber.application.MobileNumberService;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumber;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;
import com.numbertrack.backend.modules.verification.domain.VerificationActionType;
import com.numbertrack.backend.modules.verification.domain.VerificationSubmissionLog;
import com.numbertrack.backend.modules.verification.domain.VerificationToken;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.UserReportedIssueRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationSubmissionLogRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationTokenRepository;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationInfoResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationInfoResponse.NumberState;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Public side of a verification link: render the employee's numbers and record their answers.
 * A submission is all-or-nothing; the token stays valid afterwards so answers can be revised.
 */
@Service
@Transactional
public class VerificationSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(VerificationSubmissionService.class);

    static final String INVALID_LINK = "INVALID_VERIFICATION_LINK";

    private final VerificationTokenRepository tokenRepository;
    private final VerificationSubmissionLogRepository submissionLogRepository;
    private final UserReportedIssueRepository issueRepository;
    private final MobileNumberService mobileNumberService;
    private final EmployeeDirectory employeeDirectory;
    private final Clock clock;

    public VerificationSubmissionService(
            VerificationTokenRepository tokenRepository,
            VerificationSubmissionLogRepository submissionLogRepository,
            UserReportedIssueRepository issueRepository,
            MobileNumberService mobileNumberService,
            EmployeeDirectory employeeDirectory,
            Clock clock
    ) {
        this.tokenRepository = tokenRepository;
        this.submissionLogRepository = submissionLogRepository;
        this.issueRepository = issueRepository;
        this.mobileNumberService = mobileNumberService;
        this.employeeDirectory = employeeDirectory;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public VerificationInfoResponse getInfo(String tokenValue) {
        VerificationToken token = requireUsableToken(tokenValue);
        Employee employee = employeeDirectory.findByEmployeeId(token.getEmployeeId())
                .orElseThrow(this::invalidLink);

        Map<UUID, AnswerSoFar> answers = answersUnder(token);
        List<VerificationInfoResponse.PhoneNumberEntry> numbers = mobileNumberService.findHeldBy(employee.getEmployeeId())
                .stream()
                .map(number -> {
                    AnswerSoFar answer = answers.getOrDefault(number.getId(), AnswerSoFar.NONE);
                    return new VerificationInfoResponse.PhoneNumberEntry(
                            number.getId(),
                            number.getPhoneNumber(),
                            employee.getDepartment(),
                            number.getPurpose(),
                            answer.state(),
                            answer.comment());
                })
                .toList();

        List<VerificationInfoResponse.UnlistedReport> unlisted = issueRepository
                .findByVerificationTokenIdAndIssueTypeOrderByCreatedAtAsc(token.getId(), ReportedIssueType.UNLISTED_NUMBER)
                .stream()
                .map(issue -> new VerificationInfoResponse.UnlistedReport(
                        issue.getReportedPhoneNumber(), issue.getUserComment(), issue.getPurpose(), issue.getCreatedAt()))
                .toList();

        return new VerificationInfoResponse(
                employee.getEmployeeId(),
                employee.getFullName(),
                employee.getDepartment(),
                numbers,
                unlisted,
                token.getExpiresAt());
    }

    public VerificationSubmissionResponse submit(String tokenValue, VerificationSubmissionRequest request) {
        VerificationToken token = requireUsableToken(tokenValue);
        if (request.verifiedNumbersOrEmpty().isEmpty() && request.unlistedNumbersOrEmpty().isEmpty()) {
            throw ProblemException.badRequest("EMPTY_SUBMISSION", "nothing to submit");
        }
        String employeeId = token.getEmployeeId();
        OffsetDateTime now = OffsetDateTime.now(clock);
        int confirmed = 0;
        int reported = 0;

        for (VerificationSubmissionRequest.VerifiedNumber entry : request.verifiedNumbersOrEmpty()) {
            String purpose = trimToNull(entry.purpose());
            String comment = trimToNull(entry.userComment());
            MobileNumber number;
            switch (entry.action()) {
                case CONFIRM_USAGE -> {
                    number = mobileNumberService.confirmUsage(entry.mobileNumberId(), employeeId, purpose);
                    confirmed++;
                }
                case REPORT_ISSUE -> {
                    number = mobileNumberService.reportIssue(entry.mobileNumberId(), employeeId);
                    issueRepository.upsertPendingNumberIssue(token.getId(), employeeId, number.getId(), comment, purpose, now);
                    reported++;
                }
                default -> throw ProblemException.badRequest("INVALID_ACTION",
                        "action %s is not allowed for a listed number".formatted(entry.action().getValue()));
            }
            submissionLogRepository.save(VerificationSubmissionLog.append(
                    employeeId, token.getId(), number.getId(), number.getPhoneNumber(), entry.action(), purpose, comment, now));
        }

        for (VerificationSubmissionRequest.UnlistedNumber entry : request.unlistedNumbersOrEmpty()) {
            String phone = entry.phoneNumber().trim();
            String purpose = trimToNull(entry.purpose());
            String comment = trimToNull(entry.userComment());
            issueRepository.upsertPendingUnlistedReport(token.getId(), employeeId, phone, comment, purpose, now);
            submissionLogRepository.save(VerificationSubmissionLog.append(
                    employeeId, token.getId(), null, phone, VerificationActionType.REPORT_UNLISTED, purpose, comment, now));
        }

        int unlisted = request.unlistedNumbersOrEmpty().size();
        log.info("verification submitted employee={} confirmed={} reported={} unlisted={}",
                employeeId, confirmed, reported, unlisted);
        return new VerificationSubmissionResponse(confirmed, reported, unlisted, now, token.getExpiresAt());
    }

    private Map<UUID, AnswerSoFar> answersUnder(VerificationToken token) {
        Map<UUID, AnswerSoFar> answers = new HashMap<>();
        for (VerificationSubmissionLog entry : submissionLogRepository.findByVerificationTokenIdOrderByIdAsc(token.getId())) {
            if (entry.getMobileNumberId() == null) {
                continue;
            }
            AnswerSoFar current = answers.getOrDefault(entry.getMobileNumberId(), AnswerSoFar.NONE);
            if (entry.getActionType() == VerificationActionType.REPORT_ISSUE) {
                answers.put(entry.getMobileNumberId(), new AnswerSoFar(NumberState.REPORTED, entry.getUserComment()));
            } else if (entry.getActionType() == VerificationActionType.CONFIRM_USAGE && current.state() == NumberState.PENDING) {
                answers.put(entry.getMobileNumberId(), new AnswerSoFar(NumberState.CONFIRMED, null));
            }
        }
        return answers;
    }

    private VerificationToken requireUsableToken(String tokenValue) {
        if (tokenValue == null || tokenValue.isBlank()) {
            throw invalidLink();
        }
        VerificationToken token = tokenRepository.findByToken(tokenValue.trim()).orElseThrow(this::invalidLink);
        if (!token.isUsableAt(OffsetDateTime.now(clock))) {
            log.debug("rejected verification token id={} status={} expiresAt={}",
                    token.getId(), token.getStatus(), token.getExpiresAt());
            throw invalidLink();
        }
        return token;
    }

    private ProblemException invalidLink() {
        return new ProblemException(HttpStatus.GONE, INVALID_LINK, "this verification link is invalid or has expired");
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record AnswerSoFar(NumberState state, String comment) {
        static final AnswerSoFar NONE = new AnswerSoFar(NumberState.PENDING, null);
    }
}
