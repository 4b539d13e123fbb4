package com.numbertrack.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.numbertrack.backend.modules.auth.domain.AdminUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only trail of admin mutations on numbers, employees, batches and reported issues.
 * {@code resourceKey} is the natural key the operator sees (phone number, employee id, task id).
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private String actionType;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 128)
    private String resourceKey;

    // null when the change came from a public verification link or a batch worker
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "actor_user_id", updatable = false)
    private AdminUser actor;

    @Column(name = "request_id", updatable = false, length = 64)
    private String requestId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    private AuditLog(String actionType, String resourceType, String resourceKey, OffsetDateTime createdAt) {
        this.actionType = actionType;
        this.resourceType = resourceType;
        this.resourceKey = resourceKey;
        this.createdAt = createdAt;
    }

    public static AuditLog entry(String actionType, String resourceType, String resourceKey, OffsetDateTime at) {
        return new AuditLog(actionType, resourceType, resourceKey, at);
    }

    public AuditLog by(AdminUser actor) {
        this.actor = actor;
        return this;
    }

    public AuditLog correlatedWith(String requestId) {
        this.requestId = requestId;
        return this;
    }

    public AuditLog withDetail(Map<String, Object> detail) {
        this.detail = (detail == null || detail.isEmpty()) ? null : new LinkedHashMap<>(detail);
        return this;
    }

    public UUID getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public AdminUser getActor() {
        return actor;
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
