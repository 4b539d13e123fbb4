package com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberView;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;

/**
 * Filtered, sorted and paged number listings. Sort keys are mapped through a fixed whitelist,
 * so request input never reaches the query text.
 */
@Repository
public class MobileNumberQueryRepository {

    static final String DEFAULT_SORT = "m.createdAt";

    static final Map<String, String> SORT_FIELDS = Map.of(
            "phoneNumber", "m.phoneNumber",
            "applicationDate", "m.applicationDate",
            "status", "m.status",
            "vendor", "m.vendor",
            "createdAt", "m.createdAt",
            "applicantName", "applicant.fullName",
            "currentUserName", "holder.fullName",
            "applicantStatus", "applicant.employmentStatus"
    );

    private static final String SELECT_VIEW = """
            select new com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberView(
                m.id, m.phoneNumber, m.applicantEmployeeId, applicant.fullName, applicant.employmentStatus,
                m.applicationDate, m.currentEmployeeId, holder.fullName, m.status, m.purpose, m.vendor,
                m.remarks, m.cancellationDate, m.lastConfirmationDate, m.createdAt, m.updatedAt)
            """;

    private static final String FROM_JOINED = """
            from MobileNumber m
            left join Employee applicant on applicant.employeeId = m.applicantEmployeeId
            left join Employee holder on holder.employeeId = m.currentEmployeeId
            where m.deletedAt is null
            """;

    private final EntityManager entityManager;

    public MobileNumberQueryRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public PageSlice search(NumberSearchCriteria criteria) {
        Map<String, Object> params = new LinkedHashMap<>();
        StringBuilder where = new StringBuilder();

        if (criteria.search() != null && !criteria.search().isBlank()) {
            where.append(" and (m.phoneNumber like :search or lower(applicant.fullName) like :search")
                    .append(" or lower(holder.fullName) like :search)");
            params.put("search", "%" + criteria.search().trim().toLowerCase(Locale.ROOT) + "%");
        }
        if (criteria.status() != null) {
            where.append(" and m.status = :status");
            params.put("status", criteria.status());
        }
        if (criteria.excludedStatus() != null) {
            where.append(" and m.status <> :excludedStatus");
            params.put("excludedStatus", criteria.excludedStatus());
        }
        if (criteria.applicantStatus() != null) {
            where.append(" and applicant.employmentStatus = :applicantStatus");
            params.put("applicantStatus", criteria.applicantStatus());
        }

        String orderBy = " order by " + resolveSortExpression(criteria.sortBy()) + " "
                + resolveDirection(criteria.sortBy(), criteria.sortOrder()) + ", m.id asc";

        TypedQuery<MobileNumberView> query = entityManager.createQuery(
                SELECT_VIEW + FROM_JOINED + where + orderBy, MobileNumberView.class);
        TypedQuery<Long> countQuery = entityManager.createQuery(
                "select count(m) " + FROM_JOINED + where, Long.class);
        params.forEach((name, value) -> {
            query.setParameter(name, value);
            countQuery.setParameter(name, value);
        });

        query.setFirstResult((criteria.page() - 1) * criteria.size());
        query.setMaxResults(criteria.size());
        return new PageSlice(query.getResultList(), countQuery.getSingleResult());
    }

    public Optional<MobileNumberView> findViewByPhoneNumber(String phoneNumber) {
        return entityManager.createQuery(
                        SELECT_VIEW + FROM_JOINED + " and m.phoneNumber = :phoneNumber", MobileNumberView.class)
                .setParameter("phoneNumber", phoneNumber)
                .getResultStream()
                .findFirst();
    }

    static String resolveSortExpression(String sortBy) {
        if (sortBy == null) {
            return DEFAULT_SORT;
        }
        return SORT_FIELDS.getOrDefault(sortBy, DEFAULT_SORT);
    }

    static String resolveDirection(String sortBy, String sortOrder) {
        if (sortBy == null || !SORT_FIELDS.containsKey(sortBy)) {
            return "desc";
        }
        return "desc".equalsIgnoreCase(sortOrder) ? "desc" : "asc";
    }

    public record NumberSearchCriteria(
            int page,
            int size,
            String sortBy,
            String sortOrder,
            String search,
            MobileNumberStatus status,
            MobileNumberStatus excludedStatus,
            EmploymentStatus applicantStatus
    ) {
    }

    public record PageSlice(List<MobileNumberView> items, long totalCount) {
    }
}
