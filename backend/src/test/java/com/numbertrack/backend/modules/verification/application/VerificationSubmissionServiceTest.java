package com.numbertrack.backend.modules.verification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.modules.employee.application.EmployeeDirectory;
import com.numbertrack.backend.modules.mobilenumber.application.MobileNumberService;
import com.numbertrack.backend.modules.verification.domain.VerificationActionType;
import com.numbertrack.backend.modules.verification.domain.VerificationSubmissionLog;
import com.numbertrack.backend.modules.verification.domain.VerificationToken;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.UserReportedIssueRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationSubmissionLogRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationTokenRepository;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionRequest.UnlistedNumber;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionRequest.VerifiedNumber;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class VerificationSubmissionServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-10T08:00:00Z");

    @Mock
    private VerificationTokenRepository tokenRepository;

    @Mock
    private VerificationSubmissionLogRepository submissionLogRepository;

    @Mock
    private UserReportedIssueRepository issueRepository;

    @Mock
    private MobileNumberService mobileNumberService;

    @Mock
    private EmployeeDirectory employeeDirectory;

    private VerificationSubmissionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        service = new VerificationSubmissionService(
                tokenRepository, submissionLogRepository, issueRepository, mobileNumberService, employeeDirectory, clock);
    }

    @Test
    void expiredLinkIsGone() {
        when(tokenRepository.findByToken("expired"))
                .thenReturn(Optional.of(VerificationToken.issue("expired", "EMP0000001", null, NOW.minusMinutes(1))));

        assertThatThrownBy(() -> service.getInfo("expired"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE);
                    assertThat(ex.getCode()).isEqualTo(VerificationSubmissionService.INVALID_LINK);
                });
    }

    @Test
    void submittingThroughAnExpiredLinkWritesNothing() {
        when(tokenRepository.findByToken("expired"))
                .thenReturn(Optional.of(VerificationToken.issue("expired", "EMP0000001", null, NOW.minusSeconds(1))));

        assertThatThrownBy(() -> service.submit("expired", unlisted("13400134000")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE);
                    assertThat(ex.getCode()).isEqualTo(VerificationSubmissionService.INVALID_LINK);
                });
        verifyNoInteractions(submissionLogRepository, issueRepository, mobileNumberService);
        verify(tokenRepository, never()).save(any());
    }

    @Test
    void unknownOrBlankLinkIsGone() {
        when(tokenRepository.findByToken("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.submit("missing", unlisted("13400134000")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE));
        assertThatThrownBy(() -> service.getInfo("  "))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE));
    }

    @Test
    void emptySubmissionIsRejected() {
        givenUsableToken("live");

        assertThatThrownBy(() -> service.submit("live", new VerificationSubmissionRequest(List.of(), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("EMPTY_SUBMISSION"));
    }

    @Test
    void unlistedActionIsNotAcceptedForAListedNumber() {
        givenUsableToken("live");
        VerificationSubmissionRequest request = new VerificationSubmissionRequest(
                List.of(new VerifiedNumber(UUID.randomUUID(), VerificationActionType.REPORT_UNLISTED, null, null)),
                null);

        assertThatThrownBy(() -> service.submit("live", request))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_ACTION"));
        verify(submissionLogRepository, never()).save(any());
    }

    @Test
    void unlistedNumberIsUpsertedAndLoggedWithoutTouchingTheInventory() {
        VerificationToken token = givenUsableToken("live");

        VerificationSubmissionResponse response = service.submit("live", unlisted(" 13400134000 "));

        assertThat(response.unlistedReportedCount()).isEqualTo(1);
        assertThat(response.submittedAt()).isEqualTo(NOW);
        assertThat(response.tokenExpiresAt()).isEqualTo(token.getExpiresAt());
        verify(issueRepository).upsertPendingUnlistedReport(
                token.getId(), "EMP0000001", "13400134000", "spare SIM", "backup line", NOW);

        ArgumentCaptor<VerificationSubmissionLog> logEntry = ArgumentCaptor.forClass(VerificationSubmissionLog.class);
        verify(submissionLogRepository).save(logEntry.capture());
        assertThat(logEntry.getValue().getActionType()).isEqualTo(VerificationActionType.REPORT_UNLISTED);
        assertThat(logEntry.getValue().getMobileNumberId()).isNull();
        assertThat(logEntry.getValue().getPhoneNumber()).isEqualTo("13400134000");
        verify(mobileNumberService, never()).confirmUsage(any(), any(), any());
    }

    private VerificationToken givenUsableToken(String value) {
        VerificationToken token = VerificationToken.issue(value, "EMP0000001", null, NOW.plusDays(2));
        when(tokenRepository.findByToken(value)).thenReturn(Optional.of(token));
        return token;
    }

    private static VerificationSubmissionRequest unlisted(String phone) {
        return new VerificationSubmissionRequest(null, List.of(new UnlistedNumber(phone, "backup line", "spare SIM")));
    }
}
