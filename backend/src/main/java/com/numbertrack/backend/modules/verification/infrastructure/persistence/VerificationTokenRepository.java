package com.numbertrack.backend.modules.verification.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.VerificationToken;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VerificationTokenRepository extends JpaRepository<VerificationToken, UUID> {

    Optional<VerificationToken> findByToken(String token);

    boolean existsByToken(String token);

    Optional<VerificationToken> findByBatchTaskIdAndEmployeeId(UUID batchTaskId, String employeeId);
}
