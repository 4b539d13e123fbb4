package com.numbertrack.backend.modules.verification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.VerificationSubmissionLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VerificationSubmissionLogRepository extends JpaRepository<VerificationSubmissionLog, Long> {

    List<VerificationSubmissionLog> findByVerificationTokenIdOrderByIdAsc(UUID verificationTokenId);
}
