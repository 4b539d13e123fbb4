package com.numbertrack.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

import com.numbertrack.backend.global.security.JwtAuthenticationPrincipal;
import com.numbertrack.backend.global.security.SecurityUtils;
import com.numbertrack.backend.global.web.RequestIdFilter;
import com.numbertrack.backend.modules.audit.domain.AuditLog;
import com.numbertrack.backend.modules.audit.infrastructure.AuditLogRepository;
import com.numbertrack.backend.modules.auth.domain.AdminUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends audit rows inside the caller's transaction, so a rolled-back mutation leaves no trace.
 */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        AuditLog entry = AuditLog.entry(command.actionType(), command.resourceType(), command.resourceKey(),
                        OffsetDateTime.now(clock))
                .correlatedWith(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY))
                .withDetail(command.detail());
        SecurityUtils.findOperator()
                .map(JwtAuthenticationPrincipal::userId)
                .map(operatorId -> entityManager.getReference(AdminUser.class, operatorId))
                .ifPresent(entry::by);
        auditLogRepository.save(entry);
    }

    public record AuditLogCommand(String actionType, String resourceType, String resourceKey, Map<String, Object> detail) {

        public AuditLogCommand {
            Objects.requireNonNull(actionType, "actionType is required");
            Objects.requireNonNull(resourceType, "resourceType is required");
            Objects.requireNonNull(resourceKey, "resourceKey is required");
        }

        public static AuditLogCommand of(String actionType, String resourceType, String resourceKey, Map<String, Object> detail) {
            return new AuditLogCommand(actionType, resourceType, resourceKey, detail);
        }
    }
}
