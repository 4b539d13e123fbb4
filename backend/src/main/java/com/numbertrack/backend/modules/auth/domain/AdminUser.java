package com.numbertrack.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.numbertrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Back-office account allowed to call the management API.
 * {@code employeeBusinessId} links the account to the employee who acts as operator in risk handling.
 */
@Entity
@Table(name = "admin_user")
public class AdminUser extends AbstractTimestampedEntity {

    public static final String ROLE_ADMIN = "ADMIN";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, length = 50, unique = true)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "role", nullable = false, length = 20)
    private String role = ROLE_ADMIN;

    @Column(name = "employee_business_id", length = 20)
    private String employeeBusinessId;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getEmployeeBusinessId() {
        return employeeBusinessId;
    }

    public void setEmployeeBusinessId(String employeeBusinessId) {
        this.employeeBusinessId = employeeBusinessId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }
}
