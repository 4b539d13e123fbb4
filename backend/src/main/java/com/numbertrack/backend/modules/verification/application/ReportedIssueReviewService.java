package com.numbertrack.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.audit.application.AuditLogService;
import com.numbertrack.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.numbertrack.backend.modules.mobilenumber.application.MobileNumberService;
import com.numbertrack.backend.modules.verification.domain.IssueReviewStatus;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;
import com.numbertrack.backend.modules.verification.domain.UserReportedIssue;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.UserReportedIssueRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationStatusQueryRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationStatusQueryRepository.StatusFilter;
import com.numbertrack.backend.modules.verification.presentation.dto.ReportedIssueResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.ResolveIssueRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin review of reported issues. Closing the last pending report on a number returns it from
 * {@code user_reported} to its settled status.
 */
@Service
@Transactional
public class ReportedIssueReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReportedIssueReviewService.class);

    private final UserReportedIssueRepository issueRepository;
    private final VerificationStatusQueryRepository statusQueryRepository;
    private final MobileNumberService mobileNumberService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ReportedIssueReviewService(
            UserReportedIssueRepository issueRepository,
            VerificationStatusQueryRepository statusQueryRepository,
            MobileNumberService mobileNumberService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.issueRepository = issueRepository;
        this.statusQueryRepository = statusQueryRepository;
        this.mobileNumberService = mobileNumberService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ReportedIssueResponse> listIssues(String status, String issueType) {
        return statusQueryRepository.findIssues(parseIssueType(issueType), parseStatus(status), StatusFilter.none())
                .stream()
                .map(ReportedIssueResponse::from)
                .toList();
    }

    public ReportedIssueResponse resolve(UUID issueId, ResolveIssueRequest request, UUID adminUserId) {
        if (!request.status().isClosing()) {
            throw ProblemException.badRequest("INVALID_RESOLUTION",
                    "status must be resolved or ignored");
        }
        UserReportedIssue issue = issueRepository.findByIdForUpdate(issueId)
                .orElseThrow(() -> ProblemException.notFound("ISSUE_NOT_FOUND",
                        "issue %s does not exist".formatted(issueId)));
        if (!issue.isPending()) {
            throw ProblemException.conflict("ISSUE_ALREADY_RESOLVED",
                    "issue %s is already %s".formatted(issueId, issue.getAdminActionStatus().getValue()));
        }

        issue.resolve(request.status(), trimToNull(request.adminRemarks()), adminUserId, OffsetDateTime.now(clock));
        issueRepository.flush();
        if (issue.getMobileNumberId() != null
                && !issueRepository.existsByMobileNumberIdAndAdminActionStatus(issue.getMobileNumberId(), IssueReviewStatus.PENDING_REVIEW)) {
            mobileNumberService.clearUserReport(issue.getMobileNumberId());
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", request.status().getValue());
        detail.put("issueType", issue.getIssueType().getValue());
        if (issue.getAdminRemarks() != null) {
            detail.put("adminRemarks", issue.getAdminRemarks());
        }
        auditLogService.record(AuditLogCommand.of("REPORTED_ISSUE_RESOLVE", "REPORTED_ISSUE", issueId.toString(), detail));
        log.info("reported issue closed id={} status={}", issueId, request.status());

        return statusQueryRepository.findIssue(issueId)
                .map(ReportedIssueResponse::from)
                .orElseThrow(() -> new IllegalStateException("issue " + issueId + " vanished after resolve"));
    }

    private static IssueReviewStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return IssueReviewStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_STATUS", ex.getMessage());
        }
    }

    private static ReportedIssueType parseIssueType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ReportedIssueType.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_ISSUE_TYPE", ex.getMessage());
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
