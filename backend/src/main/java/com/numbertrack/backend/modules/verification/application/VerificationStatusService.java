package com.numbertrack.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.numbertrack.backend.modules.verification.domain.EligibleNumberRow;
import com.numbertrack.backend.modules.verification.domain.LatestNumberAction;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;
import com.numbertrack.backend.modules.verification.domain.VerificationActionType;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationStatusQueryRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationStatusQueryRepository.StatusFilter;
import com.numbertrack.backend.modules.verification.presentation.dto.ReportedIssueResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationStatusResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationStatusResponse.ConfirmedPhone;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationStatusResponse.PendingUser;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationStatusResponse.Summary;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Campaign-wide view built from the submission log and the live number roster. A number's
 * verification state is the action of its most recent log row.
 */
@Service
@Transactional(readOnly = true)
public class VerificationStatusService {

    private final VerificationStatusQueryRepository queryRepository;
    private final Clock clock;

    public VerificationStatusService(VerificationStatusQueryRepository queryRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.clock = clock;
    }

    public VerificationStatusResponse getStatus(String employeeId, String departmentName) {
        StatusFilter filter = new StatusFilter(employeeId, departmentName);

        List<EligibleNumberRow> eligible = queryRepository.findEligibleNumbers(filter);
        Map<UUID, LatestNumberAction> latest = queryRepository.findLatestActionPerNumber().stream()
                .collect(Collectors.toMap(LatestNumberAction::mobileNumberId, Function.identity()));

        long confirmedCount = 0;
        long reportedCount = 0;
        long pendingCount = 0;
        List<ConfirmedPhone> confirmedPhones = new ArrayList<>();
        for (EligibleNumberRow number : eligible) {
            LatestNumberAction action = latest.get(number.mobileNumberId());
            if (action == null) {
                pendingCount++;
            } else if (action.actionType() == VerificationActionType.CONFIRM_USAGE) {
                confirmedCount++;
                confirmedPhones.add(new ConfirmedPhone(
                        number.mobileNumberId(),
                        number.phoneNumber(),
                        number.holderDepartment(),
                        number.holderName(),
                        number.purpose(),
                        action.employeeName() != null ? action.employeeName() : action.employeeId(),
                        action.submittedAt()));
            } else if (action.actionType() == VerificationActionType.REPORT_ISSUE) {
                reportedCount++;
            }
        }
        confirmedPhones.sort(Comparator.comparing(ConfirmedPhone::confirmedAt).reversed());

        Summary summary = new Summary(
                eligible.size(),
                confirmedCount,
                reportedCount,
                pendingCount,
                queryRepository.countDistinctUnlistedPhones(filter));

        List<PendingUser> pendingUsers = queryRepository.findPendingUsers(filter, OffsetDateTime.now(clock)).stream()
                .map(row -> new PendingUser(
                        row.employeeId(), row.fullName(), row.email(), row.department(), row.tokenId(), row.expiresAt()))
                .toList();
        List<ReportedIssueResponse> reportedIssues = queryRepository.findIssues(ReportedIssueType.NUMBER_ISSUE, null, filter)
                .stream()
                .map(ReportedIssueResponse::from)
                .toList();
        List<ReportedIssueResponse> unlisted = queryRepository.findIssues(ReportedIssueType.UNLISTED_NUMBER, null, filter)
                .stream()
                .map(ReportedIssueResponse::from)
                .toList();

        return new VerificationStatusResponse(summary, confirmedPhones, pendingUsers, reportedIssues, unlisted);
    }
}
