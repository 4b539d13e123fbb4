package com.numbertrack.backend.modules.verification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.IssueReviewStatus;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;
import com.numbertrack.backend.modules.verification.domain.UserReportedIssue;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserReportedIssueRepository extends JpaRepository<UserReportedIssue, UUID> {

    /**
     * Creates a pending number issue or refreshes the pending one already filed by the same employee.
     * The conflict target is the partial unique index on pending rows, so concurrent duplicates collapse
     * into one row instead of failing.
     */
    @Modifying
    @Query(value = """
            insert into user_reported_issue (
                id, verification_token_id, reported_by_employee_id, mobile_number_id, issue_type,
                user_comment, purpose, admin_action_status, created_at, updated_at)
            values (
                gen_random_uuid(), :tokenId, :employeeId, :mobileNumberId, 'NUMBER_ISSUE',
                :comment, :purpose, 'PENDING_REVIEW', :now, :now)
            on conflict (reported_by_employee_id, mobile_number_id) where admin_action_status = 'PENDING_REVIEW'
            do update set
                user_comment = excluded.user_comment,
                purpose = coalesce(excluded.purpose, user_reported_issue.purpose),
                verification_token_id = excluded.verification_token_id,
                updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsertPendingNumberIssue(
            @Param("tokenId") UUID tokenId,
            @Param("employeeId") String employeeId,
            @Param("mobileNumberId") UUID mobileNumberId,
            @Param("comment") String comment,
            @Param("purpose") String purpose,
            @Param("now") OffsetDateTime now
    );

    @Modifying
    @Query(value = """
            insert into user_reported_issue (
                id, verification_token_id, reported_by_employee_id, reported_phone_number, issue_type,
                user_comment, purpose, admin_action_status, created_at, updated_at)
            values (
                gen_random_uuid(), :tokenId, :employeeId, :phoneNumber, 'UNLISTED_NUMBER',
                :comment, :purpose, 'PENDING_REVIEW', :now, :now)
            on conflict (reported_by_employee_id, reported_phone_number) where admin_action_status = 'PENDING_REVIEW'
            do update set
                user_comment = excluded.user_comment,
                purpose = excluded.purpose,
                verification_token_id = excluded.verification_token_id,
                updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsertPendingUnlistedReport(
            @Param("tokenId") UUID tokenId,
            @Param("employeeId") String employeeId,
            @Param("phoneNumber") String phoneNumber,
            @Param("comment") String comment,
            @Param("purpose") String purpose,
            @Param("now") OffsetDateTime now
    );

    List<UserReportedIssue> findByVerificationTokenIdAndIssueTypeOrderByCreatedAtAsc(
            UUID verificationTokenId,
            ReportedIssueType issueType
    );

    boolean existsByMobileNumberIdAndAdminActionStatus(UUID mobileNumberId, IssueReviewStatus adminActionStatus);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from UserReportedIssue i where i.id = :id")
    Optional<UserReportedIssue> findByIdForUpdate(@Param("id") UUID id);
}
