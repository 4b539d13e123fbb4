package com.numbertrack.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.auth.domain.AdminUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminUserRepository extends JpaRepository<AdminUser, UUID> {

    Optional<AdminUser> findByUsernameIgnoreCase(String username);
}
