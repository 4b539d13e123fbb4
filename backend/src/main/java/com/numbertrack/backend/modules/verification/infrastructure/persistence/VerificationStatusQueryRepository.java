package com.numbertrack.backend.modules.verification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.verification.domain.EligibleNumberRow;
import com.numbertrack.backend.modules.verification.domain.IssueReviewStatus;
import com.numbertrack.backend.modules.verification.domain.LatestNumberAction;
import com.numbertrack.backend.modules.verification.domain.PendingVerificationRow;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueRow;
import com.numbertrack.backend.modules.verification.domain.ReportedIssueType;
import com.numbertrack.backend.modules.verification.domain.VerificationActionType;
import com.numbertrack.backend.modules.verification.domain.VerificationTokenStatus;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;

/**
 * Read queries behind the admin verification status view. Filters narrow by employee business id
 * and/or department of the person the row belongs to (holder, reporter or token owner).
 */
@Repository
public class VerificationStatusQueryRepository {

    private static final String ISSUE_ROW_SELECT = """
            select new com.numbertrack.backend.modules.verification.domain.ReportedIssueRow(
                i.id, i.issueType, coalesce(m.phoneNumber, i.reportedPhoneNumber), m.status,
                i.reportedByEmployeeId, e.fullName, e.department, i.userComment, i.purpose,
                i.adminActionStatus, i.adminRemarks, i.createdAt, i.updatedAt)
            from UserReportedIssue i
            left join MobileNumber m on m.id = i.mobileNumberId
            left join Employee e on e.employeeId = i.reportedByEmployeeId
            where 1 = 1
            """;

    private final EntityManager entityManager;

    public VerificationStatusQueryRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public List<EligibleNumberRow> findEligibleNumbers(StatusFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        String jpql = """
                select new com.numbertrack.backend.modules.verification.domain.EligibleNumberRow(
                    m.id, m.phoneNumber, m.purpose, holder.employeeId, holder.fullName, holder.department)
                from MobileNumber m
                left join Employee holder on holder.employeeId = m.currentEmployeeId
                where m.deletedAt is null
                  and m.status <> :deactivated
                """ + filterClause(filter, "holder", params) + " order by m.phoneNumber asc";
        params.put("deactivated", MobileNumberStatus.DEACTIVATED);
        return bind(entityManager.createQuery(jpql, EligibleNumberRow.class), params).getResultList();
    }

    /**
     * Most recent log row for every number that has one. Later timestamp wins; equal timestamps fall
     * back to insertion order.
     */
    public List<LatestNumberAction> findLatestActionPerNumber() {
        return entityManager.createQuery("""
                        select new com.numbertrack.backend.modules.verification.domain.LatestNumberAction(
                            l.mobileNumberId, l.actionType, l.employeeId, e.fullName, l.createdAt)
                        from VerificationSubmissionLog l
                        left join Employee e on e.employeeId = l.employeeId
                        where l.mobileNumberId is not null
                          and not exists (
                              select 1 from VerificationSubmissionLog later
                              where later.mobileNumberId = l.mobileNumberId
                                and (later.createdAt > l.createdAt
                                     or (later.createdAt = l.createdAt and later.id > l.id)))
                        """, LatestNumberAction.class)
                .getResultList();
    }

    public long countDistinctUnlistedPhones(StatusFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        String jpql = """
                select count(distinct l.phoneNumber)
                from VerificationSubmissionLog l
                left join Employee e on e.employeeId = l.employeeId
                where l.actionType = :action
                """ + filterClause(filter, "e", params);
        params.put("action", VerificationActionType.REPORT_UNLISTED);
        return bind(entityManager.createQuery(jpql, Long.class), params).getSingleResult();
    }

    public List<PendingVerificationRow> findPendingUsers(StatusFilter filter, OffsetDateTime now) {
        Map<String, Object> params = new LinkedHashMap<>();
        String jpql = """
                select new com.numbertrack.backend.modules.verification.domain.PendingVerificationRow(
                    e.employeeId, e.fullName, e.email, e.department, t.id, t.expiresAt)
                from VerificationToken t
                join Employee e on e.employeeId = t.employeeId
                where t.status = :pending
                  and t.expiresAt > :now
                """ + filterClause(filter, "e", params) + " order by t.expiresAt asc, e.employeeId asc";
        params.put("pending", VerificationTokenStatus.PENDING);
        params.put("now", now);
        return bind(entityManager.createQuery(jpql, PendingVerificationRow.class), params).getResultList();
    }

    public List<ReportedIssueRow> findIssues(ReportedIssueType issueType, IssueReviewStatus status, StatusFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        StringBuilder jpql = new StringBuilder(ISSUE_ROW_SELECT);
        if (issueType != null) {
            jpql.append(" and i.issueType = :issueType");
            params.put("issueType", issueType);
        }
        if (status != null) {
            jpql.append(" and i.adminActionStatus = :status");
            params.put("status", status);
        }
        jpql.append(filterClause(filter, "e", params)).append(" order by i.createdAt desc, i.id asc");
        return bind(entityManager.createQuery(jpql.toString(), ReportedIssueRow.class), params).getResultList();
    }

    public Optional<ReportedIssueRow> findIssue(UUID issueId) {
        return entityManager.createQuery(ISSUE_ROW_SELECT + " and i.id = :issueId", ReportedIssueRow.class)
                .setParameter("issueId", issueId)
                .getResultStream()
                .findFirst();
    }

    private static String filterClause(StatusFilter filter, String alias, Map<String, Object> params) {
        if (filter == null) {
            return "";
        }
        StringBuilder clause = new StringBuilder();
        if (filter.employeeId() != null) {
            clause.append(" and ").append(alias).append(".employeeId = :filterEmployeeId");
            params.put("filterEmployeeId", filter.employeeId());
        }
        if (filter.department() != null) {
            clause.append(" and ").append(alias).append(".department = :filterDepartment");
            params.put("filterDepartment", filter.department());
        }
        return clause.toString();
    }

    private static <T> TypedQuery<T> bind(TypedQuery<T> query, Map<String, Object> params) {
        params.forEach(query::setParameter);
        return query;
    }

    /**
     * Blank values mean "no filter".
     */
    public record StatusFilter(String employeeId, String department) {

        public StatusFilter {
            employeeId = employeeId == null || employeeId.isBlank() ? null : employeeId.trim();
            department = department == null || department.isBlank() ? null : department.trim();
        }

        public static StatusFilter none() {
            return new StatusFilter(null, null);
        }
    }
}
